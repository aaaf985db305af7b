package org.carball.pivot.validator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class RegressionInputStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnEmptyForUnknownFunction() throws Exception {
        assertThat(new RegressionInputStore(tempDir).load("missing")).isEmpty();
    }

    @Test
    void shouldAppendWithoutDuplicatesAndRestoreTypes() throws Exception {
        // Given
        RegressionInputStore store = new RegressionInputStore(tempDir.resolve("regressions"));

        // When
        int first = store.append("calc", List.of(List.of(1L, 2.5, "x"), List.of(-3L, 0.0, "")));
        int second = store.append("calc", List.of(List.of(1L, 2.5, "x"), List.of(7L, 1.0, "y")));

        // Then
        assertThat(first).isEqualTo(2);
        assertThat(second).isEqualTo(1);
        List<List<Object>> loaded = new RegressionInputStore(tempDir.resolve("regressions")).load("calc");
        assertThat(loaded).containsExactly(
                List.of(1L, 2.5, "x"), List.of(-3L, 0.0, ""), List.of(7L, 1.0, "y"));
        assertThat(loaded.get(0).get(0)).isInstanceOf(Long.class);
    }

    @Test
    void shouldSanitizeFileNames() throws Exception {
        RegressionInputStore store = new RegressionInputStore(tempDir);

        store.append("zero?", List.of(List.of(true)));

        assertThat(tempDir.resolve("zero_.json")).exists();
        assertThat(store.load("zero?")).containsExactly(List.of(true));
    }

    @Test
    void shouldIgnoreEmptyAppend() throws Exception {
        RegressionInputStore store = new RegressionInputStore(tempDir.resolve("none"));

        assertThat(store.append("calc", List.of())).isZero();
        assertThat(tempDir.resolve("none")).doesNotExist();
    }
}
