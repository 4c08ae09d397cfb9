package regstat.ml;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class DesignMatrixTest {

    private static Map<String, double[]> columns() {
        Map<String, double[]> x = new LinkedHashMap<>();
        x.put("b", new double[]{1, 2, 3});
        x.put("a", new double[]{4, 5, 6});
        return x;
    }

    @Test
    public void testInterceptAppendedLast() {
        DesignMatrix d = DesignMatrix.of(columns(), true);
        assertThat(d.names()).containsExactly("b", "a", "intercept");
        assertThat(d.rows()).isEqualTo(3);
        assertThat(d.columns()).isEqualTo(3);
        assertThat(d.hasIntercept()).isTrue();
        assertThat(d.column(2)).containsExactly(1, 1, 1);
        assertThat(d.row(1)).containsExactly(2, 5, 1);
        assertThat(d.indexOf("a")).isEqualTo(1);
    }

    @Test
    public void testWithoutIntercept() {
        DesignMatrix d = DesignMatrix.of(columns(), false);
        assertThat(d.names()).containsExactly("b", "a");
        assertThat(d.hasIntercept()).isFalse();
        assertThat(d.matrix().getColumn(1)).containsExactly(4, 5, 6);
    }

    @Test
    public void testFromRows() {
        double[][] rows = {{1, 4}, {2, 5}, {3, 6}};
        DesignMatrix d = DesignMatrix.of(rows, Arrays.asList("b", "a"), true);
        assertThat(d.matrix().getData()).isDeepEqualTo(DesignMatrix.of(columns(), true).matrix().getData());
        rows[0][0] = 99;
        assertThat(d.row(0)[0]).isEqualTo(1);
    }

    @Test
    public void testGram() {
        DesignMatrix d = DesignMatrix.of(columns(), true);
        // column b against itself and against the intercept
        assertThat(d.gram().getEntry(0, 0)).isEqualTo(14);
        assertThat(d.gram().getEntry(0, 2)).isEqualTo(6);
        assertThat(d.gram().getEntry(2, 2)).isEqualTo(3);
    }

    @Test
    public void testAlign() {
        DesignMatrix d = DesignMatrix.of(columns(), true);
        assertThat(d.align(new double[][]{{7, 8}})[0]).containsExactly(7, 8, 1);
        assertThatThrownBy(() -> d.align(new double[][]{{7, 8, 1}})).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testInvalidInput() {
        Map<String, double[]> ragged = columns();
        ragged.put("c", new double[]{1, 2});
        assertThatThrownBy(() -> DesignMatrix.of(ragged, true))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("'c'");

        Map<String, double[]> reserved = columns();
        reserved.put("intercept", new double[]{1, 1, 1});
        assertThatThrownBy(() -> DesignMatrix.of(reserved, true)).isInstanceOf(IllegalArgumentException.class);
        assertThat(DesignMatrix.of(reserved, false).columns()).isEqualTo(3);

        assertThatThrownBy(() -> DesignMatrix.of(new LinkedHashMap<>(), true))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DesignMatrix.of(new double[][]{{1, 2}}, Arrays.asList("a", "a"), false))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
