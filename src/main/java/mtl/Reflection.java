package mtl;

import java.util.EnumMap;
import java.util.Map;

/** refl 语句：每行填一个 -type 槽位，多行可填不同槽位 */
public final class Reflection extends Parsed {

    private final Map<ReflectionType, Texture> slots = new EnumMap<>(ReflectionType.class);

    public Reflection(){
        for (ReflectionType type : ReflectionType.values()) slots.put(type, new Texture());
    }

    public Texture slot(ReflectionType type){ return slots.get(type); }

    public void copyFrom(Reflection source, boolean keepParsed){
        for (ReflectionType type : ReflectionType.values()) {
            slots.get(type).copyFrom(source.slots.get(type), keepParsed);
        }
        copyParsed(source, keepParsed);
    }
}
