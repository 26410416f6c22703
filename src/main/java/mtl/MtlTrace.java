package mtl;

import java.io.PrintStream;

/** 按 mtl 语法输出已解析的值，输出可原样读回 */
public final class MtlTrace {

    private MtlTrace(){ }

    public static void print(MtlDocument document, PrintStream out){
        out.print(render(document));
        out.flush();
    }

    public static String render(MtlDocument document){
        StringBuilder sb = new StringBuilder();
        for (String info : document.information()) {
            sb.append("# ").append(info).append('\n');
        }
        for (Material m : document.materials()) {
            sb.append(render(m));
        }
        return sb.toString();
    }

    public static String render(Material m){
        StringBuilder sb = new StringBuilder("\n");
        if (m.name.isParsed()) sb.append("newmtl ").append(m.name.get()).append('\n');
        for (Keywords.Binding<?> b : Keywords.all()) {
            Parsed field = b.field(m);
            if (field.isParsed()) statement(sb, b.keyword(), field);
        }
        return sb.toString();
    }

    private static void statement(StringBuilder sb, String keyword, Parsed field){
        if (field instanceof Color c) {
            if (c.rgb.isParsed()) line(sb, keyword, triple(c.rgb));
            if (c.xyz.isParsed()) line(sb, keyword, "xyz " + triple(c.xyz));
            if (c.spectral.isParsed()) line(sb, keyword, "spectral " + c.spectral.file() + " " + num(c.spectral.factor()));
        } else if (field instanceof Texture t) {
            line(sb, keyword, texture(t));
        } else if (field instanceof Opacity o) {
            line(sb, keyword, (o.halo() ? "-halo " : "") + num(o.d()));
        } else if (field instanceof Reflection r) {
            for (ReflectionType type : ReflectionType.values()) {
                Texture slot = r.slot(type);
                if (slot.isParsed()) line(sb, keyword, "-type " + type.keyword() + " " + texture(slot));
            }
        } else if (field instanceof Field<?> f) {
            line(sb, keyword, value(f.get()));
        }
    }

    static String texture(Texture t){
        StringBuilder sb = new StringBuilder();
        flag(sb, "-blendu", t.blendu);
        flag(sb, "-blendv", t.blendv);
        flag(sb, "-clamp", t.clamp);
        flag(sb, "-cc", t.cc);
        flag(sb, "-bm", t.bm);
        flag(sb, "-boost", t.boost);
        flag(sb, "-texres", t.texres);
        if (t.mm.isParsed()) sb.append("-mm ").append(t.mm.base()).append(' ').append(t.mm.gain()).append(' ');
        if (t.o.isParsed()) sb.append("-o ").append(triple(t.o)).append(' ');
        if (t.s.isParsed()) sb.append("-s ").append(triple(t.s)).append(' ');
        if (t.t.isParsed()) sb.append("-t ").append(triple(t.t)).append(' ');
        flag(sb, "-imfchan", t.imfchan);
        if (t.file.isParsed()) sb.append(t.file.get());
        return sb.toString().trim();
    }

    private static void flag(StringBuilder sb, String flag, Field<?> f){
        if (f.isParsed()) sb.append(flag).append(' ').append(value(f.get())).append(' ');
    }

    private static void line(StringBuilder sb, String keyword, String value){
        sb.append(keyword).append(' ').append(value).append('\n');
    }

    private static String triple(Triple t){ return num(t.x()) + " " + num(t.y()) + " " + num(t.z()); }

    private static String value(Object v){
        if (v instanceof Boolean b) return b ? "on" : "off";
        if (v instanceof Double d) return num(d);
        return String.valueOf(v);
    }

    /** 整数值不带小数部分，其余用 Double.toString 保证能原样读回；溢出写成 1e999 */
    static String num(double d){
        if (Double.isInfinite(d)) return d > 0 ? "1e999" : "-1e999";
        if (Double.doubleToRawLongBits(d) == Double.doubleToRawLongBits(-0.0)) return "-0";
        if (d == Math.rint(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
        return Double.toString(d);
    }
}
