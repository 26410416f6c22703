package mtl;

import java.util.Objects;

public final class Field<T> extends Parsed {

    private T value;

    public Field(T initial){ this.value = Objects.requireNonNull(initial); }

    public T get(){ return value; }

    /** 显式赋值，等同于从文本解析成功 */
    public void set(T value){
        this.value = Objects.requireNonNull(value);
        parsed(true);
    }

    public void copyFrom(Field<T> source, boolean keepParsed){
        value = source.value;
        copyParsed(source, keepParsed);
    }

    @Override public String toString(){ return String.valueOf(value); }
}
