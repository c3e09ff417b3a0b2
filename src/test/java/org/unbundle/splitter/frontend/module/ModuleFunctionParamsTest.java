package org.unbundle.splitter.frontend.module;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModuleFunctionParamsTest {

    @Test
    void firstFactoryFixesNames() {
        ModuleFunctionParams params = new ModuleFunctionParams();

        assertThat(params.accept(List.of("e", "t", "n"))).isEmpty();

        assertThat(params.module()).contains("e");
        assertThat(params.exports()).contains("t");
        assertThat(params.require()).contains("n");
    }

    @Test
    void shorterListsFixOnlyTheirPositions() {
        ModuleFunctionParams params = new ModuleFunctionParams();

        assertThat(params.accept(List.of("e"))).isEmpty();
        assertThat(params.require()).isEmpty();

        assertThat(params.accept(List.of("e", "t", "n"))).isEmpty();
        assertThat(params.require()).contains("n");
        assertThat(params.accept(List.of())).isEmpty();
    }

    @Test
    void conflictingNameIsReturned() {
        ModuleFunctionParams params = new ModuleFunctionParams();
        params.accept(List.of("e", "t", "n"));

        assertThat(params.accept(List.of("e", "r"))).contains("r");
        assertThat(params.exports()).contains("t");
    }

    @Test
    void rejectedListDoesNotFixNewPositions() {
        ModuleFunctionParams params = new ModuleFunctionParams();
        params.accept(List.of("e", "t"));

        assertThat(params.accept(List.of("e", "x", "n"))).contains("x");

        assertThat(params.require()).isEmpty();
        assertThat(params.accept(List.of("e", "t", "r"))).isEmpty();
        assertThat(params.require()).contains("r");
    }

    @Test
    void tooManyParamsAreRejected() {
        ModuleFunctionParams params = new ModuleFunctionParams();

        assertThatThrownBy(() -> params.accept(List.of("a", "b", "c", "d")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
