package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.domain.CellTemperatureReport;
import com.elssolution.bmsdashboard.domain.SeriesStats;
import com.elssolution.bmsdashboard.domain.TempStats;
import com.elssolution.bmsdashboard.error.BmsDataException;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

@Slf4j
public class CellTemperatureLeg implements AcquisitionLeg<CellTemperatureReport> {

    private final EndpointFetcher fetcher;
    private final PatternExtractor extractor;
    private final FieldDecoder decoder;
    private final FirmwareProfile profile;
    private final SanitizePolicy policy;

    public CellTemperatureLeg(EndpointFetcher fetcher, PatternExtractor extractor, FieldDecoder decoder,
                              FirmwareProfile profile, SanitizePolicy policy) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.decoder = decoder;
        this.profile = profile;
        this.policy = policy;
    }

    @Override
    public Leg leg() {
        return Leg.CELL_TEMPERATURE;
    }

    @Override
    public CellTemperatureReport acquire(String address, boolean sanitize) throws BmsDataException {
        String body = fetcher.fetch(address, profile.cellTemperatureResource());
        SeriesPlan plan = profile.cellTemperaturePlan();
        double[] temps = decoder.decodeCelsius(extractor.extract(body, plan.key()), plan);

        if (sanitize) {
            double rawAvg = OutlierSanitizer.sanitizeCelsius(temps, policy.replace());
            if (log.isDebugEnabled()) log.debug("bms_tcell_sanitized rawAvg={}°C fence={}", rawAvg, policy.replace());
        }

        Optional<ReportFence> report = sanitize ? policy.reportFence() : Optional.empty();
        int n = temps.length;
        double avg = SeriesStats.meanCelsius(temps);
        int split = profile.cellTemperaturePartition().splitIndex(n);

        if (split <= 0 || split >= n) {
            TempStats overall = fenced(SeriesStats.ofCelsius(temps), temps, 0, n, report);
            return new CellTemperatureReport(temps, overall, null, null);
        }
        TempStats right = fenced(SeriesStats.ofCelsius(temps, 0, split), temps, 0, split, report);
        TempStats left = fenced(SeriesStats.ofCelsius(temps, split, n), temps, split, n, report);
        return new CellTemperatureReport(temps, TempStats.union(left, right, avg), left, right);
    }

    private static TempStats fenced(TempStats s, double[] temps, int from, int to, Optional<ReportFence> report) {
        return report.map(f -> OutlierSanitizer.applyReportFence(s, temps, from, to, f)).orElse(s);
    }
}
