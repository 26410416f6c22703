package mtl;

/** rgb / xyz / uvw 三元组 */
public final class Triple extends Parsed {

    private double x, y, z;

    public Triple(){ }

    public Triple(double x, double y, double z){ this.x = x; this.y = y; this.z = z; }

    public double x(){ return x; }
    public double y(){ return y; }
    public double z(){ return z; }

    public void set(double x, double y, double z){
        this.x = x; this.y = y; this.z = z;
        parsed(true);
    }

    public void copyFrom(Triple source, boolean keepParsed){
        x = source.x; y = source.y; z = source.z;
        copyParsed(source, keepParsed);
    }

    @Override public String toString(){ return x + " " + y + " " + z; }
}
