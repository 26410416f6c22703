package mtl;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/** 普通语句的值解析；整体成功才写入，失败时字段保持原样 */
public final class Decoders {

    private Decoders(){ }

    public static boolean integer(String text, Field<Integer> field){
        OptionalInt v = new LineCursor(text).nextInt();
        if (v.isEmpty()) return false;
        field.set(v.getAsInt());
        return true;
    }

    public static boolean real(String text, Field<Double> field){
        return realAt(new LineCursor(text), field);
    }

    static boolean realAt(LineCursor c, Field<Double> field){
        OptionalDouble v = c.nextDouble();
        if (v.isEmpty()) return false;
        field.set(v.getAsDouble());
        return true;
    }

    /** 只有一个数时三个分量相同；缺第三个时取第一个（不是第二个） */
    public static boolean triple(LineCursor c, Triple target){
        OptionalDouble x = c.nextDouble();
        if (x.isEmpty()) return false;

        OptionalDouble y = c.nextDouble();
        if (y.isEmpty()) {
            target.set(x.getAsDouble(), x.getAsDouble(), x.getAsDouble());
            return true;
        }
        OptionalDouble z = c.nextDouble();
        target.set(x.getAsDouble(), y.getAsDouble(), z.orElse(x.getAsDouble()));
        return true;
    }

    /** -mm base gain；gain 缺省时保留原值 */
    public static boolean baseGain(LineCursor c, BaseGain target){
        OptionalInt base = c.nextInt();
        if (base.isEmpty()) return false;
        target.set(base.getAsInt(), c.nextInt().orElse(target.gain()));
        return true;
    }

    public static boolean spectral(LineCursor c, Spectral target){
        Optional<String> file = c.nextWord();
        if (file.isEmpty()) return false;
        target.set(file.get(), c.nextDouble().orElse(target.factor()));
        return true;
    }

    /** 依次尝试 "spectral "、"xyz "，否则按 rgb 解析 */
    public static boolean color(String text, Color color){
        boolean ok;
        if (text.startsWith("spectral ")) {
            ok = spectral(new LineCursor(text.substring("spectral ".length())), color.spectral);
        } else if (text.startsWith("xyz ")) {
            ok = triple(new LineCursor(text.substring("xyz ".length())), color.xyz);
        } else {
            ok = triple(new LineCursor(text), color.rgb);
        }
        if (ok) color.parsed(true);
        return ok;
    }
}
