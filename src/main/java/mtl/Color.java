package mtl;

/** Kd/Ka/... 颜色：每行只填 rgb、xyz、spectral 其中之一 */
public final class Color extends Parsed {

    public final Triple rgb = new Triple();
    public final Triple xyz = new Triple();
    public final Spectral spectral = new Spectral();

    public void copyFrom(Color source, boolean keepParsed){
        rgb.copyFrom(source.rgb, keepParsed);
        xyz.copyFrom(source.xyz, keepParsed);
        spectral.copyFrom(source.spectral, keepParsed);
        copyParsed(source, keepParsed);
    }
}
