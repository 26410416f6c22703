package mtl;

import java.util.Optional;
import java.util.OptionalDouble;

/** 带 -option 参数的语句：贴图、d、refl */
public final class OptionDecoders {

    private static final String CHANNELS = "rgbmlz";

    private OptionDecoders(){ }

    // [-option args...]... [file]
    // 未知选项连同参数跳到下一个 -，但保留最后一个 token 给文件名；文件名可含空格
    public static boolean texture(String text, Texture texture){
        LineCursor c = new LineCursor(text);
        boolean any = false;

        while (c.peek() == '-') {
            String flag = c.nextToken();
            int afterFlag = c.position();
            Boolean applied = option(flag.substring(1), c, texture);
            if (applied == null) {
                c.reset(afterFlag);
                skipArguments(c);
            } else {
                any |= applied;
            }
        }

        String file = c.remainder();
        if (!file.isEmpty()) {
            texture.file.set(file);
            any = true;
        }
        if (any) texture.parsed(true);
        return any;
    }

    /** TRUE 已应用，FALSE 已读取但忽略（如 -clamp maybe），null 未知选项或值非法 */
    private static Boolean option(String name, LineCursor c, Texture texture){
        return switch (name) {
            case "blendu" -> onOff(c, texture.blendu);
            case "blendv" -> onOff(c, texture.blendv);
            case "clamp"  -> onOff(c, texture.clamp);
            case "bm"     -> Decoders.realAt(c, texture.bm) ? Boolean.TRUE : null;
            case "boost"  -> Decoders.realAt(c, texture.boost) ? Boolean.TRUE : null;
            case "texres" -> Decoders.realAt(c, texture.texres) ? Boolean.TRUE : null;
            case "mm"     -> Decoders.baseGain(c, texture.mm) ? Boolean.TRUE : null;
            case "o"      -> Decoders.triple(c, texture.o) ? Boolean.TRUE : null;
            case "s"      -> Decoders.triple(c, texture.s) ? Boolean.TRUE : null;
            case "t"      -> Decoders.triple(c, texture.t) ? Boolean.TRUE : null;
            case "imfchan" -> channel(c, texture.imfchan);
            default -> null;
        };
    }

    private static Boolean onOff(LineCursor c, Field<Boolean> target){
        Optional<String> w = c.nextWord();
        if (w.isEmpty()) return null;
        return switch (w.get()) {
            case "on" -> { target.set(true); yield Boolean.TRUE; }
            case "off" -> { target.set(false); yield Boolean.TRUE; }
            default -> Boolean.FALSE;
        };
    }

    // 只接受单个字符 r/g/b/m/l/z，否则当作未知选项
    private static Boolean channel(LineCursor c, Field<Character> target){
        Optional<String> w = c.nextWord();
        if (w.isEmpty() || w.get().length() != 1 || CHANNELS.indexOf(w.get().charAt(0)) < 0) return null;
        target.set(w.get().charAt(0));
        return Boolean.TRUE;
    }

    private static void skipArguments(LineCursor c){
        while (c.peek() != 0 && c.peek() != '-' && !c.nextIsLastToken()) {
            c.nextToken();
        }
    }

    /** 有 -halo 则同时设置系数和 halo，否则整行按系数解析并关闭 halo */
    public static boolean opacity(String text, Opacity opacity){
        LineCursor c = new LineCursor(text);
        for (String token = c.nextToken(); !token.isEmpty(); token = c.nextToken()) {
            if (token.equals("-halo")) {
                OptionalDouble factor = c.nextDouble();
                if (factor.isPresent()) {
                    opacity.set(factor.getAsDouble(), true);
                    return true;
                }
            }
        }
        OptionalDouble bare = new LineCursor(text).nextDouble();
        if (bare.isEmpty()) return false;
        opacity.set(bare.getAsDouble(), false);
        return true;
    }

    /** -type <槽位> 之后的整行按贴图解析 */
    public static boolean reflection(String text, Reflection reflection){
        LineCursor c = new LineCursor(text);
        for (String token = c.nextToken(); !token.isEmpty(); token = c.nextToken()) {
            if (!token.equals("-type")) continue;

            ReflectionType type = ReflectionType.byKeyword(c.nextToken());
            if (type == null) return false;
            if (!texture(c.remainder(), reflection.slot(type))) return false;
            reflection.parsed(true);
            return true;
        }
        return false;
    }
}
