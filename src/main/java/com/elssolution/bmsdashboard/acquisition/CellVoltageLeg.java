package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.domain.CellVoltageReport;
import com.elssolution.bmsdashboard.domain.SeriesStats;
import com.elssolution.bmsdashboard.domain.Topology;
import com.elssolution.bmsdashboard.domain.VoltageStats;
import com.elssolution.bmsdashboard.error.BmsDataException;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

import static com.elssolution.bmsdashboard.acquisition.FirmwareProfile.*;

/**
 * Cell voltages: topology header ({@code PSet0}) and the per-cell array ({@code PSet})
 * both come from the same page.
 */
@Slf4j
public class CellVoltageLeg implements AcquisitionLeg<CellVoltageReport> {

    private final EndpointFetcher fetcher;
    private final PatternExtractor extractor;
    private final FieldDecoder decoder;
    private final FirmwareProfile profile;
    private final SanitizePolicy policy;

    public CellVoltageLeg(EndpointFetcher fetcher, PatternExtractor extractor, FieldDecoder decoder,
                          FirmwareProfile profile, SanitizePolicy policy) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.decoder = decoder;
        this.profile = profile;
        this.policy = policy;
    }

    @Override
    public Leg leg() {
        return Leg.CELL_VOLTAGE;
    }

    @Override
    public CellVoltageReport acquire(String address, boolean sanitize) throws BmsDataException {
        String body = fetcher.fetch(address, profile.cellVoltageResource());

        DecodePlan topoPlan = profile.topologyPlan();
        DecodedFields t = decoder.decode(extractor.extract(body, topoPlan.key()), topoPlan);
        Topology topology = new Topology(
                t.intValue(SLAVES),
                t.intValue(CELLS),
                t.intValue(CELLS_PER_SLAVE),
                t.intValue(TEMP_SENSORS),
                t.intValue(SAFETY_RESISTORS));

        SeriesPlan cellPlan = profile.cellVoltagePlan();
        int[] mv = decoder.decodeMillivolts(extractor.extract(body, cellPlan.key()), cellPlan);

        if (sanitize) {
            int rawAvg = OutlierSanitizer.sanitizeMillivolts(mv, policy.replace());
            if (log.isDebugEnabled()) log.debug("bms_ucell_sanitized rawAvg={}mV fence={}", rawAvg, policy.replace());
        }
        if (topology.cells() != mv.length) {
            log.debug("bms_ucell_count_mismatch announced={} received={}", topology.cells(), mv.length);
        }

        Optional<ReportFence> report = sanitize ? policy.reportFence() : Optional.empty();
        int n = mv.length;
        int avg = SeriesStats.meanMillivolts(mv);
        int split = profile.cellVoltagePartition().splitIndex(n);

        if (split <= 0 || split >= n) {
            VoltageStats overall = fenced(SeriesStats.ofMillivolts(mv), mv, 0, n, report);
            return new CellVoltageReport(topology, mv, overall, null, null);
        }
        VoltageStats right = fenced(SeriesStats.ofMillivolts(mv, 0, split), mv, 0, split, report);
        VoltageStats left = fenced(SeriesStats.ofMillivolts(mv, split, n), mv, split, n, report);
        VoltageStats overall = VoltageStats.union(left, right, avg);
        return new CellVoltageReport(topology, mv, overall, left, right);
    }

    private static VoltageStats fenced(VoltageStats s, int[] mv, int from, int to, Optional<ReportFence> report) {
        return report.map(f -> OutlierSanitizer.applyReportFence(s, mv, from, to, f)).orElse(s);
    }
}
