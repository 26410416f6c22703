package mtl;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** 逐行构建 MtlDocument；第一个 newmtl 命名哨兵材质，之后每个 newmtl 追加模板副本 */
public final class MtlDecoder {

    private static final String NEWMTL = "newmtl";

    private final Material template;
    private final MtlDocument document = new MtlDocument();

    public MtlDecoder(){ this(new Material()); }

    public MtlDecoder(Material template){
        this.template = Material.copyOf(Objects.requireNonNull(template, "template"), false);
        document.materials().add(Material.copyOf(this.template, false));
    }

    /** 文件头注释、newmtl 或成功解析的语句返回 true */
    public boolean decode(String rawLine){
        String line = LineCursor.trim(rawLine);
        if (line.isEmpty()) return false;

        List<Material> materials = document.materials();
        Material current = materials.get(materials.size() - 1);

        if (line.charAt(0) == '#') {
            if (current.name.isParsed()) return false;  // 材质内的注释直接丢弃
            document.information().add(LineCursor.trim(line.substring(1)));
            return true;
        }

        LineCursor c = new LineCursor(line);
        String keyword = c.nextToken();
        String rest = c.remainder();
        if (rest.isEmpty()) return false;

        if (keyword.equals(NEWMTL)) {
            if (current.name.isParsed()) {
                current = Material.copyOf(template, false);
                materials.add(current);
            }
            current.name.set(rest);
            return true;
        }

        Keywords.Binding<?> binding = Keywords.lookup(keyword);
        return binding != null && binding.decode(current, rest);
    }

    /** 至少有一个材质被命名才算成功 */
    public Optional<MtlDocument> finish(){
        return document.materials().get(0).name.isParsed() ? Optional.of(document) : Optional.empty();
    }

    /** 当前结果，失败时也可查看 */
    public MtlDocument document(){ return document; }
}
