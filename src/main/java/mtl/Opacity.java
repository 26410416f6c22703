package mtl;

/** d 语句：溶解系数 + halo */
public final class Opacity extends Parsed {

    private double d = 1;
    private boolean halo = false;

    public double d(){ return d; }
    public boolean halo(){ return halo; }

    public void set(double d, boolean halo){
        this.d = d; this.halo = halo;
        parsed(true);
    }

    public void copyFrom(Opacity source, boolean keepParsed){
        d = source.d; halo = source.halo;
        copyParsed(source, keepParsed);
    }
}
