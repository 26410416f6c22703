package mtl;

import java.util.Objects;

/** spectral 颜色：光谱文件 + 缩放系数 */
public final class Spectral extends Parsed {

    private String file = "";
    private double factor = 1;

    public String file(){ return file; }
    public double factor(){ return factor; }

    public void set(String file, double factor){
        this.file = Objects.requireNonNull(file);
        this.factor = factor;
        parsed(true);
    }

    public void copyFrom(Spectral source, boolean keepParsed){
        file = source.file; factor = source.factor;
        copyParsed(source, keepParsed);
    }
}
