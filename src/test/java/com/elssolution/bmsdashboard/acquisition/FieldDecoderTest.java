package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.error.FieldMissingException;
import com.elssolution.bmsdashboard.error.FieldUnparseableException;
import org.junit.jupiter.api.Test;

import static com.elssolution.bmsdashboard.acquisition.FirmwareProfile.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldDecoderTest {

    private final FieldDecoder decoder = new FieldDecoder();

    @Test
    void decodes_main_panel_layout_with_skips_and_scales() throws Exception {
        String payload = "0,48500,0,0,1500,0,0,650,0,0,250,0,0,210,0,0,320,0,0,400";

        DecodedFields f = decoder.decode(payload, S3.mainPlan());

        assertThat(f.decimal(VOLTAGE)).isEqualTo(48.5);
        assertThat(f.decimal(CURRENT)).isEqualTo(1500.0);
        assertThat(f.decimal(STATE_OF_CHARGE)).isEqualTo(65.0);
        assertThat(f.decimal(TEMP_AVG)).isEqualTo(25.0);
        assertThat(f.decimal(TEMP_MIN)).isEqualTo(21.0);
        assertThat(f.decimal(TEMP_MAX)).isEqualTo(32.0);
        assertThat(f.decimal(TEMP_MASTER)).isEqualTo(40.0);
        assertThat(f.asMap()).containsOnlyKeys(VOLTAGE, CURRENT, STATE_OF_CHARGE,
                TEMP_AVG, TEMP_MIN, TEMP_MAX, TEMP_MASTER);
    }

    @Test
    void decodes_topology_integers() throws Exception {
        DecodedFields f = decoder.decode("8,144,18,16,2", S3.topologyPlan());

        assertThat(f.intValue(SLAVES)).isEqualTo(8);
        assertThat(f.intValue(CELLS)).isEqualTo(144);
        assertThat(f.intValue(CELLS_PER_SLAVE)).isEqualTo(18);
        assertThat(f.intValue(TEMP_SENSORS)).isEqualTo(16);
        assertThat(f.intValue(SAFETY_RESISTORS)).isEqualTo(2);
    }

    @Test
    void short_payload_reports_missing_position_and_field() {
        // ends right before temp_max would be read (position 16)
        String payload = "0,48500,0,0,1500,0,0,650,0,0,250,0,0,210";

        assertThatThrownBy(() -> decoder.decode(payload, S3.mainPlan()))
                .isInstanceOf(FieldMissingException.class)
                .satisfies(e -> {
                    FieldMissingException fm = (FieldMissingException) e;
                    assertThat(fm.getPosition()).isEqualTo(16);
                    assertThat(fm.getFieldName()).isEqualTo(TEMP_MAX);
                });
    }

    @Test
    void unparseable_field_carries_name_and_token() {
        String payload = "0,48500,0,0,abc,0,0,650,0,0,250,0,0,210,0,0,320,0,0,400";

        assertThatThrownBy(() -> decoder.decode(payload, S3.mainPlan()))
                .isInstanceOf(FieldUnparseableException.class)
                .satisfies(e -> {
                    FieldUnparseableException fu = (FieldUnparseableException) e;
                    assertThat(fu.getPosition()).isEqualTo(4);
                    assertThat(fu.getFieldName()).isEqualTo(CURRENT);
                    assertThat(fu.getRawToken()).isEqualTo("abc");
                });
    }

    @Test
    void decimal_rejects_non_plain_numbers() {
        DecodePlan plan = DecodePlan.of("k", FieldSpec.decimal("x", 0, 1.0));
        assertThatThrownBy(() -> decoder.decode("NaN", plan)).isInstanceOf(FieldUnparseableException.class);
        assertThatThrownBy(() -> decoder.decode("0x1p3", plan)).isInstanceOf(FieldUnparseableException.class);
        assertThatThrownBy(() -> decoder.decode("", plan)).isInstanceOf(FieldUnparseableException.class);
    }

    @Test
    void integer_field_rejects_fraction() {
        DecodePlan plan = DecodePlan.of("k", FieldSpec.integer("n", 0));
        assertThatThrownBy(() -> decoder.decode("1.5", plan)).isInstanceOf(FieldUnparseableException.class);
    }

    @Test
    void topology_count_beyond_int_range_is_unparseable() {
        assertThatThrownBy(() -> decoder.decode("1,99999999999,4,2,0", S3.topologyPlan()))
                .isInstanceOf(FieldUnparseableException.class)
                .satisfies(e -> {
                    FieldUnparseableException fu = (FieldUnparseableException) e;
                    assertThat(fu.getPosition()).isEqualTo(1);
                    assertThat(fu.getFieldName()).isEqualTo(CELLS);
                    assertThat(fu.getRawToken()).isEqualTo("99999999999");
                });
    }

    @Test
    void millivolt_series_skips_header_and_keeps_order() throws Exception {
        int[] mv = decoder.decodeMillivolts("0,0,3700,3710,3690,3720", S3.cellVoltagePlan());
        assertThat(mv).containsExactly(3700, 3710, 3690, 3720);
    }

    @Test
    void series_blank_tokens_read_as_zero_and_trailing_separator_is_dropped() throws Exception {
        int[] mv = decoder.decodeMillivolts("0,0,3700,,3690,", S3.cellVoltagePlan());
        assertThat(mv).containsExactly(3700, 0, 3690);
    }

    @Test
    void series_rejects_garbage_and_negative_millivolts() {
        assertThatThrownBy(() -> decoder.decodeMillivolts("0,0,3700,x1,3690", S3.cellVoltagePlan()))
                .isInstanceOf(FieldUnparseableException.class)
                .satisfies(e -> assertThat(((FieldUnparseableException) e).getPosition()).isEqualTo(3));
        assertThatThrownBy(() -> decoder.decodeMillivolts("0,0,-5", S3.cellVoltagePlan()))
                .isInstanceOf(FieldUnparseableException.class);
    }

    @Test
    void series_shorter_than_header_is_missing() {
        assertThatThrownBy(() -> decoder.decodeMillivolts("0", S3.cellVoltagePlan()))
                .isInstanceOf(FieldMissingException.class);
    }

    @Test
    void header_only_series_is_empty() throws Exception {
        assertThat(decoder.decodeMillivolts("0,0", S3.cellVoltagePlan())).isEmpty();
    }

    @Test
    void temperature_series_scaled_to_degrees() throws Exception {
        double[] t = decoder.decodeCelsius("0,215,220,-35", S3.cellTemperaturePlan());
        assertThat(t).containsExactly(21.5, 22.0, -3.5);
    }
}
