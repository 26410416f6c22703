package mtl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/** 从磁盘、classpath 或 Reader 读取 .mtl；上一次的第一个材质作为下一次的默认值（不带解析标记） */
public class MtlLoader {

    private static final Logger LOGGER = LogManager.getLogger(MtlLoader.class);
    private static final char BOM = '\uFEFF';

    private MtlDocument document = new MtlDocument();

    public MtlLoader(){ }

    public MtlLoader(Material template){
        document.materials().add(Material.copyOf(Objects.requireNonNull(template, "template"), false));
    }

    public boolean load(Path path){
        LOGGER.debug("Loading materials from {}", path);
        try (BufferedReader br = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(br, path.toString());
        } catch (IOException e) {
            LOGGER.error("Unable to read material file {}", path, e);
            return false;
        }
    }

    /** @param baseDir 以资源根为基准的目录，如 "assets/Losalia/" */
    public boolean loadResource(String baseDir, String mtlFile){
        String resPath = join(baseDir, mtlFile);
        LOGGER.debug("Loading materials from resource {}", resPath);
        InputStream in = MtlLoader.class.getClassLoader().getResourceAsStream(resPath);
        try {
            if (in == null) throw new FileNotFoundException("mtl resource not found: " + resPath);
            try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                return read(br, resPath);
            }
        } catch (IOException e) {
            LOGGER.error("Unable to read material resource {}", resPath, e);
            return false;
        }
    }

    /** 不关闭 reader，IO 异常交给调用方 */
    public boolean load(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        return read(br, "reader");
    }

    private boolean read(BufferedReader br, String source) throws IOException {
        MtlDecoder decoder = new MtlDecoder(defaultMaterial());
        String line;
        boolean first = true;
        while ((line = br.readLine()) != null) {
            if (first && !line.isEmpty() && line.charAt(0) == BOM) line = line.substring(1);
            first = false;
            decoder.decode(line);
        }
        document = decoder.document();

        Optional<MtlDocument> result = decoder.finish();
        if (result.isEmpty()) {
            LOGGER.warn("No newmtl statement in {}", source);
            return false;
        }
        LOGGER.debug("Loaded {} material(s) from {}", document.materials().size(), source);
        return true;
    }

    private Material defaultMaterial(){
        List<Material> materials = document.materials();
        return materials.isEmpty() ? new Material() : Material.copyOf(materials.get(0), false);
    }

    public List<Material> materials(){ return document.materials(); }

    public List<String> information(){ return document.information(); }

    public MtlDocument document(){ return document; }

    public Optional<Material> lookup(String materialName){ return document.lookup(materialName); }

    public void trace(PrintStream out){ MtlTrace.print(document, out); }

    private static String join(String a, String b){
        if (a==null || a.isEmpty()) return b;
        a = a.endsWith("/") ? a : (a + "/");
        return a + (b.startsWith("/") ? b.substring(1) : b);
    }
}
