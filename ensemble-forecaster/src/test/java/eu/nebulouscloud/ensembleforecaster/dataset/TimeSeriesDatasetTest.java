package eu.nebulouscloud.ensembleforecaster.dataset;

import eu.nebulouscloud.ensembleforecaster.TestDatasets;
import eu.nebulouscloud.ensembleforecaster.exception.InsufficientDataException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeSeriesDatasetTest {

    private static final LocalDateTime T0 = TestDatasets.START;

    @Test
    void rejectsTimestampsThatAreNotIncreasing() {
        List<LocalDateTime> timestamps = List.of(T0, T0.plusDays(2), T0.plusDays(1));
        assertThrows(IllegalArgumentException.class,
                () -> TimeSeriesDataset.of(timestamps, "value", new double[]{1, 2, 3}));
    }

    @Test
    void rejectsFieldWithWrongLength() {
        assertThrows(IllegalArgumentException.class,
                () -> TimeSeriesDataset.of(TestDatasets.dailyTimestamps(3), "value", new double[]{1, 2}));
    }

    @Test
    void rejectsDatasetWithoutFields() {
        assertThrows(IllegalArgumentException.class,
                () -> TimeSeriesDataset.builder().timestamps(TestDatasets.dailyTimestamps(3)).build());
    }

    @Test
    void targetValuesMustNotBeMissing() {
        TimeSeriesDataset dataset = TimeSeriesDataset.of(
                TestDatasets.dailyTimestamps(3), "value", new double[]{1, Double.NaN, 3});

        assertThrows(IllegalArgumentException.class, () -> dataset.getTargetValues("value"));
        assertThrows(IllegalArgumentException.class, () -> dataset.getTargetValues("unknown"));
        assertTrue(Double.isNaN(dataset.getValues("value")[1]));
    }

    @Test
    void forwardFillKeepsLeadingGaps() {
        TimeSeriesDataset dataset = TimeSeriesDataset.of(
                TestDatasets.dailyTimestamps(5), "value", new double[]{Double.NaN, 2, Double.NaN, Double.NaN, 5});

        double[] filled = dataset.forwardFill("value").getValues("value");

        assertTrue(Double.isNaN(filled[0]));
        assertArrayEquals(new double[]{2, 2, 2, 5}, Arrays.copyOfRange(filled, 1, 5));
        assertTrue(Double.isNaN(dataset.getValues("value")[2]));
    }

    @Test
    void slicesKeepRowsAligned() {
        TimeSeriesDataset dataset = TestDatasets.linear(10, 0, 1);

        TimeSeriesDataset middle = dataset.slice(3, 6);
        assertEquals(3, middle.size());
        assertEquals(T0.plusDays(3), middle.getFirstTimestamp());
        assertArrayEquals(new double[]{3, 4, 5}, middle.getTargetValues("value"));

        assertEquals(4, dataset.head(4).size());
        assertEquals(T0.plusDays(7), dataset.tail(3).getFirstTimestamp());
        assertEquals(10, dataset.tail(50).size());
        assertTrue(dataset.slice(10, 10).isEmpty());
        assertThrows(IndexOutOfBoundsException.class, () -> dataset.slice(5, 11));
    }

    @Test
    void infersMedianStep() {
        List<LocalDateTime> timestamps = List.of(T0, T0.plusDays(1), T0.plusDays(2), T0.plusDays(4));
        TimeSeriesDataset dataset = TimeSeriesDataset.of(timestamps, "value", new double[]{1, 2, 3, 4});

        assertEquals(Duration.ofDays(1), dataset.inferStep());
        assertThrows(InsufficientDataException.class, () -> dataset.head(1).inferStep());
    }

    @Test
    void infersSubSecondStep() {
        assertEquals(Duration.ofMillis(500), TestDatasets.regular(5, Duration.ofMillis(500)).inferStep());
        assertEquals(Duration.ofMillis(1500), TestDatasets.regular(5, Duration.ofMillis(1500)).inferStep());
    }

    @Test
    void keepsSeveralFields() {
        TimeSeriesDataset dataset = TimeSeriesDataset.builder()
                .timestamps(TestDatasets.dailyTimestamps(2))
                .field("cpu", new double[]{0.5, 0.7})
                .field("memory", new double[]{100, 120})
                .build();

        assertEquals(List.of("cpu", "memory"), List.copyOf(dataset.getFieldNames()));
        assertTrue(dataset.hasField("memory"));
        assertArrayEquals(new double[]{100, 120}, dataset.getTargetValues("memory"));
    }
}
