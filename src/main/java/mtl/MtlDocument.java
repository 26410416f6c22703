package mtl;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** 解析结果：按源文件顺序的材质 + 文件头注释 */
public final class MtlDocument {

    private final List<Material> materials = new ArrayList<>();
    private final List<String> information = new ArrayList<>();

    public List<Material> materials(){ return materials; }

    /** 第一个 newmtl 之前的注释，去掉 # */
    public List<String> information(){ return information; }

    public Optional<Material> lookup(String name){
        for (Material m : materials) {
            if (m.name.get().equals(name)) return Optional.of(m);
        }
        return Optional.empty();
    }
}
