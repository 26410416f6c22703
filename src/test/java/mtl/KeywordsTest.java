package mtl;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class KeywordsTest {

    @Test
    void everyStatementKeywordIsBound() {
        assertThat(Keywords.all()).extracting(Keywords.Binding::keyword).containsExactlyInAnyOrder(
                "Kd", "Ka", "Ks", "Tf", "Ns", "map_Kd", "map_Ka", "map_Ks", "map_Ns", "map_Pr", "map_Pm",
                "map_Ps", "map_d", "map_bump", "map_Po", "sharpness", "d", "disp", "decal", "bump", "illum",
                "Ni", "Tr", "refl", "Ke", "Pr", "Pm", "Ps", "Pc", "Pcr", "aniso", "anisor", "map_Ke", "norm",
                "map_RMA", "map_ORM");
    }

    @Test
    void keywordsAreCaseSensitive() {
        assertThat(Keywords.lookup("kd")).isNull();
        assertThat(Keywords.lookup("newmtl")).isNull();
    }

    @Test
    void bindingWritesIntoItsOwnSlot() {
        Material m = new Material();
        assertThat(Keywords.lookup("Pcr").decode(m, "0.04")).isTrue();
        assertThat(m.pcr.get()).isEqualTo(0.04);
        assertThat(m.pc.isParsed()).isFalse();

        assertThat(Keywords.lookup("map_bump").decode(m, "-bm 2 n.png")).isTrue();
        assertThat(m.mapBump.bm.get()).isEqualTo(2.0);
        assertThat(m.bump.isParsed()).isFalse();
        assertThat(Keywords.lookup("map_bump").field(m)).isSameAs(m.mapBump);
    }
}
