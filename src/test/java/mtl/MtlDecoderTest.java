package mtl;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class MtlDecoderTest {

    private static MtlDecoder decodeAll(MtlDecoder decoder, String text) {
        for (String line : text.split("\n", -1)) decoder.decode(line);
        return decoder;
    }

    @Test
    void twoMaterialsWithHeader() {
        String text = String.join("\n",
                "# header",
                "newmtl mat_1",
                "Ka 0.328013 0.328013 0.328013",
                "Kd 0.627451 0.627451 0.627451",
                "Ns 750.000000",
                "newmtl mat_2",
                "Ka 0.031400 0.031400 0.031400",
                "Kd 0.098039 0.098039 0.098039",
                "Ks 0.977692 0.968577 0.945277");

        Optional<MtlDocument> result = decodeAll(new MtlDecoder(), text).finish();
        assertThat(result).isPresent();
        MtlDocument doc = result.get();

        assertThat(doc.information()).containsExactly("header");
        List<Material> materials = doc.materials();
        assertThat(materials).extracting(m -> m.name.get()).containsExactly("mat_1", "mat_2");

        Material first = materials.get(0);
        assertThat(first.ks.isParsed()).isFalse();
        assertThat(first.ns.get()).isEqualTo(750.0);
        assertThat(first.ka.rgb.x()).isEqualTo(0.328013);

        Material second = materials.get(1);
        assertThat(second.ns.isParsed()).isFalse();
        assertThat(second.ns.get()).isEqualTo(0.0);
        assertThat(second.ks.rgb.y()).isEqualTo(0.968577);
    }

    @Test
    void decodeReportsWhetherLineWasConsumed() {
        MtlDecoder decoder = new MtlDecoder();
        assertThat(decoder.decode("# header")).isTrue();
        assertThat(decoder.decode("   ")).isFalse();
        assertThat(decoder.decode("newmtl red")).isTrue();
        assertThat(decoder.decode("Kd 1 0 0")).isTrue();
        assertThat(decoder.decode("Kd crimson")).isFalse();
        assertThat(decoder.decode("vt 0.5 0.5")).isFalse();
        assertThat(decoder.decode("Kd")).isFalse();
        assertThat(decoder.decode("# note")).isFalse();
    }

    @Test
    void malformedLinesNeverAbortTheDecode() {
        MtlDecoder decoder = decodeAll(new MtlDecoder(), String.join("\n",
                "newmtl a",
                "Kd 0.1 0.2 0.3",
                "Kd not-a-color",
                "illum two",
                "map_Kd -bm",
                "bogus statement here",
                "Ns 10",
                "newmtl b"));

        MtlDocument doc = decoder.finish().orElseThrow();
        Material a = doc.lookup("a").orElseThrow();
        assertThat(a.kd.rgb.z()).isEqualTo(0.3);
        assertThat(a.illum.isParsed()).isFalse();
        assertThat(a.mapKd.isParsed()).isFalse();
        assertThat(a.ns.get()).isEqualTo(10.0);
        assertThat(doc.lookup("b")).isPresent();
    }

    @Test
    void commentsAfterFirstMaterialAreNotHeader() {
        MtlDocument doc = decodeAll(new MtlDecoder(), "#one\n#  two  \nnewmtl a\n# three\nnewmtl b\n# four")
                .finish().orElseThrow();
        assertThat(doc.information()).containsExactly("one", "two");
    }

    @Test
    void statementsBeforeFirstNewmtlBelongToFirstMaterial() {
        MtlDocument doc = decodeAll(new MtlDecoder(), "Kd 1 0 0\nnewmtl first\nnewmtl second")
                .finish().orElseThrow();
        assertThat(doc.materials()).hasSize(2);
        assertThat(doc.materials().get(0).kd.isParsed()).isTrue();
        assertThat(doc.materials().get(1).kd.isParsed()).isFalse();
    }

    @Test
    void noMaterialNameFailsButStateStaysInspectable() {
        MtlDecoder decoder = decodeAll(new MtlDecoder(), "# only comments\nKd 1 0 0\nnewmtl");
        assertThat(decoder.finish()).isEmpty();
        assertThat(decoder.document().materials()).hasSize(1);
        assertThat(decoder.document().materials().get(0).kd.isParsed()).isTrue();
        assertThat(decoder.document().information()).containsExactly("only comments");
    }

    @Test
    void templateValuesSeedEveryMaterialWithoutProvenance() {
        Material template = new Material();
        template.ka.rgb.set(1, 0, 0);
        template.ka.parsed(true);
        template.illum.set(2);

        MtlDecoder decoder = new MtlDecoder(template);
        Material sentinel = decoder.document().materials().get(0);
        assertThat(sentinel.ka.isParsed()).isFalse();
        assertThat(sentinel.ka.rgb.isParsed()).isFalse();
        assertThat(sentinel.ka.rgb.x()).isEqualTo(1.0);

        decodeAll(decoder, "newmtl a\nillum 4\nnewmtl b");
        Material b = decoder.document().lookup("b").orElseThrow();
        assertThat(b.illum.get()).isEqualTo(2);
        assertThat(b.illum.isParsed()).isFalse();
        assertThat(decoder.document().lookup("a").orElseThrow().illum.get()).isEqualTo(4);
        assertThat(template.illum.isParsed()).isTrue();
    }

    @Test
    void newmtlNameIsRestOfLine() {
        MtlDocument doc = decodeAll(new MtlDecoder(), "newmtl   Brushed Steel #2  ").finish().orElseThrow();
        assertThat(doc.materials().get(0).name.get()).isEqualTo("Brushed Steel #2");
    }
}
