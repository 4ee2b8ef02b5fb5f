package io.github.yok.chunkdblink.core;

import io.github.yok.chunkdblink.dataset.ColumnType;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-column statistics derived from a sample.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class ColumnProfile {

    // Column name as in the header row
    private final String name;

    // Type inferred from the sample's cells
    private final ColumnType type;

    // Number of missing cells in the sample
    private final long missingCount;

    // Estimated heap bytes of the sample's values for this column
    private final long memoryBytes;
}
