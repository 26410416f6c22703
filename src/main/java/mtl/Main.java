package mtl;

import java.nio.file.Path;

/** 读取 .mtl 文件并按 mtl 语法打印解析结果 */
public class Main {

    public static void main(String[] args){
        System.exit(run(args));
    }

    static int run(String... args){
        if (args.length == 0) {
            System.err.println("usage: Main <file.mtl>...");
            return 1;
        }
        int status = 0;
        for (String arg : args) {
            MtlLoader loader = new MtlLoader();
            if (!loader.load(Path.of(arg))) {
                System.err.println("failed to load materials: " + arg);
                status = 1;
                continue;
            }
            System.out.println("# " + arg + ": " + loader.materials().size() + " material(s)");
            loader.trace(System.out);
        }
        return status;
    }
}
