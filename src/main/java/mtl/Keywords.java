package mtl;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiPredicate;
import java.util.function.Function;

/** 关键字 → (材质字段, 解析函数)；顺序即 MtlTrace 的输出顺序 */
public final class Keywords {

    public record Binding<F extends Parsed>(String keyword, Function<Material, F> slot, BiPredicate<String, F> decoder) {

        public F field(Material m){ return slot.apply(m); }

        public boolean decode(Material m, String text){ return decoder.test(text, slot.apply(m)); }
    }

    private static final Map<String, Binding<?>> TABLE = build();

    private Keywords(){ }

    /** 非材质语句返回 null */
    public static Binding<?> lookup(String keyword){ return TABLE.get(keyword); }

    public static Collection<Binding<?>> all(){ return Collections.unmodifiableCollection(TABLE.values()); }

    private static Map<String, Binding<?>> build(){
        Map<String, Binding<?>> t = new LinkedHashMap<>();
        bind(t, "Ka", m -> m.ka, Decoders::color);
        bind(t, "Kd", m -> m.kd, Decoders::color);
        bind(t, "Ks", m -> m.ks, Decoders::color);
        bind(t, "Ke", m -> m.ke, Decoders::color);
        bind(t, "map_Kd", m -> m.mapKd, OptionDecoders::texture);
        bind(t, "map_Ka", m -> m.mapKa, OptionDecoders::texture);
        bind(t, "map_Ks", m -> m.mapKs, OptionDecoders::texture);
        bind(t, "map_Ke", m -> m.mapKe, OptionDecoders::texture);
        bind(t, "map_Ns", m -> m.mapNs, OptionDecoders::texture);
        bind(t, "map_Pr", m -> m.mapPr, OptionDecoders::texture);
        bind(t, "map_Pm", m -> m.mapPm, OptionDecoders::texture);
        bind(t, "map_Ps", m -> m.mapPs, OptionDecoders::texture);
        bind(t, "map_d", m -> m.mapD, OptionDecoders::texture);
        bind(t, "map_bump", m -> m.mapBump, OptionDecoders::texture);
        bind(t, "map_Po", m -> m.mapPo, OptionDecoders::texture);
        bind(t, "Ns", m -> m.ns, Decoders::real);
        bind(t, "Tf", m -> m.tf, Decoders::color);
        bind(t, "Tr", m -> m.tr, Decoders::real);
        bind(t, "sharpness", m -> m.sharpness, Decoders::real);
        bind(t, "d", m -> m.d, OptionDecoders::opacity);
        bind(t, "disp", m -> m.disp, OptionDecoders::texture);
        bind(t, "decal", m -> m.decal, OptionDecoders::texture);
        bind(t, "bump", m -> m.bump, OptionDecoders::texture);
        bind(t, "illum", m -> m.illum, Decoders::integer);
        bind(t, "Ni", m -> m.ni, Decoders::real);
        bind(t, "refl", m -> m.refl, OptionDecoders::reflection);
        bind(t, "Pr", m -> m.pr, Decoders::real);
        bind(t, "Pm", m -> m.pm, Decoders::real);
        bind(t, "Ps", m -> m.ps, Decoders::real);
        bind(t, "Pc", m -> m.pc, Decoders::real);
        bind(t, "Pcr", m -> m.pcr, Decoders::real);
        bind(t, "aniso", m -> m.aniso, Decoders::real);
        bind(t, "anisor", m -> m.anisor, Decoders::real);
        bind(t, "norm", m -> m.norm, OptionDecoders::texture);
        bind(t, "map_RMA", m -> m.mapRma, OptionDecoders::texture);
        bind(t, "map_ORM", m -> m.mapOrm, OptionDecoders::texture);
        return Collections.unmodifiableMap(t);
    }

    private static <F extends Parsed> void bind(Map<String, Binding<?>> t, String keyword,
                                                Function<Material, F> slot, BiPredicate<String, F> decoder){
        t.put(keyword, new Binding<>(keyword, slot, decoder));
    }
}
