package webpackre.build;

import org.junit.Test;

import static com.google.common.truth.Truth.assertThat;

public class FactoryParamsTest {

    @Test
    public void unifyKeepsFixedSlots() {
        FactoryParams fixed = FactoryParams.of("e", "t");
        FactoryParams unified = fixed.unify(FactoryParams.of("e", "t", "n"));

        assertThat(unified).isEqualTo(FactoryParams.of("e", "t", "n"));
        assertThat(fixed.size()).isEqualTo(2);
        assertThat(fixed.unify(FactoryParams.of("e"))).isSameInstanceAs(fixed);
    }

    @Test
    public void conflicts() {
        FactoryParams params = FactoryParams.of("e", "t", "n");

        assertThat(params.findConflict(FactoryParams.of("e", "t"))).isEqualTo(-1);
        assertThat(params.findConflict(FactoryParams.of("e", "x", "n"))).isEqualTo(FactoryParams.EXPORTS);
        assertThat(params.findConflict(FactoryParams.of("m"))).isEqualTo(FactoryParams.MODULE);
        assertThat(FactoryParams.EMPTY.findConflict(params)).isEqualTo(-1);
    }

    @Test
    public void slots() {
        FactoryParams params = FactoryParams.of("e", "t");

        assertThat(params.getModuleName()).isEqualTo("e");
        assertThat(params.getExportsName()).isEqualTo("t");
        assertThat(params.getRequireName()).isNull();
        assertThat(params.limit(1)).isEqualTo(FactoryParams.of("e"));
    }
}
