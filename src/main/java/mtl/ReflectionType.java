package mtl;

/** refl -type 的取值 */
public enum ReflectionType {
    SPHERE("sphere"),
    CUBE_TOP("cube_top"),
    CUBE_BOTTOM("cube_bottom"),
    CUBE_FRONT("cube_front"),
    CUBE_BACK("cube_back"),
    CUBE_LEFT("cube_left"),
    CUBE_RIGHT("cube_right");

    private final String keyword;

    ReflectionType(String keyword){ this.keyword = keyword; }

    public String keyword(){ return keyword; }

    /** 不是七个槽位之一时返回 null */
    public static ReflectionType byKeyword(String name){
        for (ReflectionType type : values()) {
            if (type.keyword.equals(name)) return type;
        }
        return null;
    }
}
