package mtl;

/** 一个 newmtl 块；缺省值取常见导出器的约定 */
public class Material {
    public final Field<String> name = new Field<>("");

    public final Color kd = new Color();          // Kd 漫反射
    public final Color ka = new Color();          // Ka 环境光
    public final Color ks = new Color();          // Ks 高光
    public final Color tf = new Color();          // Tf 透射
    public final Field<Double> ns = new Field<>(0.0);   // 高光指数 [0..1000]

    public final Texture mapKd = new Texture();
    public final Texture mapKa = new Texture();
    public final Texture mapKs = new Texture();
    public final Texture mapNs = new Texture();
    public final Texture mapPr = new Texture();
    public final Texture mapPm = new Texture();
    public final Texture mapPs = new Texture();
    public final Texture mapD = new Texture();
    public final Texture mapBump = new Texture();
    public final Texture mapPo = new Texture();

    public final Field<Double> sharpness = new Field<>(60.0);
    public final Opacity d = new Opacity();
    public final Texture disp = new Texture();
    public final Texture decal = new Texture();
    public final Texture bump = new Texture();    // 有的导出器用 bump 代替 map_bump
    public final Field<Integer> illum = new Field<>(0);
    public final Field<Double> ni = new Field<>(0.0);
    public final Field<Double> tr = new Field<>(1.0);
    public final Reflection refl = new Reflection();

    // PBR 扩展（Clara.io）
    public final Color ke = new Color();
    public final Field<Double> pr = new Field<>(0.0);
    public final Field<Double> pm = new Field<>(0.0);
    public final Field<Double> ps = new Field<>(0.0);
    public final Field<Double> pc = new Field<>(0.0);
    public final Field<Double> pcr = new Field<>(0.0);
    public final Field<Double> aniso = new Field<>(0.0);
    public final Field<Double> anisor = new Field<>(0.0);
    public final Texture mapKe = new Texture();
    public final Texture norm = new Texture();

    // DirectXMesh
    public final Texture mapRma = new Texture();
    public final Texture mapOrm = new Texture();

    public Material(){ }

    /** keepParsed=false：只复制值，不复制解析标记（用于默认模板） */
    public static Material copyOf(Material source, boolean keepParsed){
        Material m = new Material();
        m.copyFrom(source, keepParsed);
        return m;
    }

    public Material copy(){ return copyOf(this, true); }

    public void copyFrom(Material src, boolean keepParsed){
        name.copyFrom(src.name, keepParsed);
        kd.copyFrom(src.kd, keepParsed);
        ka.copyFrom(src.ka, keepParsed);
        ks.copyFrom(src.ks, keepParsed);
        tf.copyFrom(src.tf, keepParsed);
        ns.copyFrom(src.ns, keepParsed);
        mapKd.copyFrom(src.mapKd, keepParsed);
        mapKa.copyFrom(src.mapKa, keepParsed);
        mapKs.copyFrom(src.mapKs, keepParsed);
        mapNs.copyFrom(src.mapNs, keepParsed);
        mapPr.copyFrom(src.mapPr, keepParsed);
        mapPm.copyFrom(src.mapPm, keepParsed);
        mapPs.copyFrom(src.mapPs, keepParsed);
        mapD.copyFrom(src.mapD, keepParsed);
        mapBump.copyFrom(src.mapBump, keepParsed);
        mapPo.copyFrom(src.mapPo, keepParsed);
        sharpness.copyFrom(src.sharpness, keepParsed);
        d.copyFrom(src.d, keepParsed);
        disp.copyFrom(src.disp, keepParsed);
        decal.copyFrom(src.decal, keepParsed);
        bump.copyFrom(src.bump, keepParsed);
        illum.copyFrom(src.illum, keepParsed);
        ni.copyFrom(src.ni, keepParsed);
        tr.copyFrom(src.tr, keepParsed);
        refl.copyFrom(src.refl, keepParsed);
        ke.copyFrom(src.ke, keepParsed);
        pr.copyFrom(src.pr, keepParsed);
        pm.copyFrom(src.pm, keepParsed);
        ps.copyFrom(src.ps, keepParsed);
        pc.copyFrom(src.pc, keepParsed);
        pcr.copyFrom(src.pcr, keepParsed);
        aniso.copyFrom(src.aniso, keepParsed);
        anisor.copyFrom(src.anisor, keepParsed);
        mapKe.copyFrom(src.mapKe, keepParsed);
        norm.copyFrom(src.norm, keepParsed);
        mapRma.copyFrom(src.mapRma, keepParsed);
        mapOrm.copyFrom(src.mapOrm, keepParsed);
    }

    @Override public String toString(){ return "Material[" + name.get() + "]"; }
}
