package mtl;

/** 贴图：文件名 + 各选项，任一项解析成功即视为已解析 */
public final class Texture extends Parsed {

    public final Field<String> file = new Field<>("");

    public final Field<Boolean> blendu = new Field<>(true);
    public final Field<Boolean> blendv = new Field<>(true);
    public final Field<Boolean> clamp = new Field<>(false);
    public final Field<Boolean> cc = new Field<>(false);      // 没有任何选项会打开它
    public final Field<Double> bm = new Field<>(0.0);
    public final Field<Double> boost = new Field<>(60.0);
    public final Field<Double> texres = new Field<>(1.0);
    public final BaseGain mm = new BaseGain();
    public final Triple o = new Triple();
    public final Triple s = new Triple();
    public final Triple t = new Triple();
    public final Field<Character> imfchan = new Field<>('m');

    public void copyFrom(Texture source, boolean keepParsed){
        file.copyFrom(source.file, keepParsed);
        blendu.copyFrom(source.blendu, keepParsed);
        blendv.copyFrom(source.blendv, keepParsed);
        clamp.copyFrom(source.clamp, keepParsed);
        cc.copyFrom(source.cc, keepParsed);
        bm.copyFrom(source.bm, keepParsed);
        boost.copyFrom(source.boost, keepParsed);
        texres.copyFrom(source.texres, keepParsed);
        mm.copyFrom(source.mm, keepParsed);
        o.copyFrom(source.o, keepParsed);
        s.copyFrom(source.s, keepParsed);
        t.copyFrom(source.t, keepParsed);
        imfchan.copyFrom(source.imfchan, keepParsed);
        copyParsed(source, keepParsed);
    }
}
