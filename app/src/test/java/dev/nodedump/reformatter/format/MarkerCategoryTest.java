package dev.nodedump.reformatter.format;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MarkerCategoryTest {

    @Test
    void classifiesMarkers() {
        assertThat(MarkerCategory.of('{')).isEqualTo(MarkerCategory.OPEN_BLOCK);
        assertThat(MarkerCategory.of('}')).isEqualTo(MarkerCategory.CLOSE_BLOCK);
        assertThat(MarkerCategory.of('(')).isEqualTo(MarkerCategory.OPEN_GROUP);
        assertThat(MarkerCategory.of(')')).isEqualTo(MarkerCategory.CLOSE_GROUP);
        assertThat(MarkerCategory.of(':')).isEqualTo(MarkerCategory.FIELD_SEPARATOR);
    }

    @Test
    void treatsEverythingElseAsText() {
        assertThat(MarkerCategory.of('x')).isEqualTo(MarkerCategory.TEXT);
        assertThat(MarkerCategory.of(' ')).isEqualTo(MarkerCategory.TEXT);
        assertThat(MarkerCategory.of('<')).isEqualTo(MarkerCategory.TEXT);
    }
}
