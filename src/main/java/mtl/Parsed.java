package mtl;

/** 来源标记：值是否由 .mtl 文本（或显式赋值）提供，而不是模板默认值 */
public abstract class Parsed {

    private boolean parsed;

    public boolean isParsed(){ return parsed; }

    public boolean parsed(boolean set){
        parsed = set;
        return set;
    }

    /** keepParsed=false 时目标一律视为“未解析”，用于构造默认模板 */
    protected void copyParsed(Parsed source, boolean keepParsed){
        parsed = keepParsed && source.parsed;
    }
}
