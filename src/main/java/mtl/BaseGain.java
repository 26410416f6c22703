package mtl;

/** 贴图的 -mm base gain */
public final class BaseGain extends Parsed {

    private int base = 0;
    private int gain = 1;

    public int base(){ return base; }
    public int gain(){ return gain; }

    public void set(int base, int gain){
        this.base = base; this.gain = gain;
        parsed(true);
    }

    public void copyFrom(BaseGain source, boolean keepParsed){
        base = source.base; gain = source.gain;
        copyParsed(source, keepParsed);
    }
}
