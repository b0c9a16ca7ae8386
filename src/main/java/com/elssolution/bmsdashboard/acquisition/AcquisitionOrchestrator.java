package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.domain.CellTemperatureReport;
import com.elssolution.bmsdashboard.domain.CellVoltageReport;
import com.elssolution.bmsdashboard.domain.MainReading;
import com.elssolution.bmsdashboard.error.BmsDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Starts poll cycles: the three legs run concurrently on the acquisition pool,
 * sharing nothing but their read-only collaborators.
 *
 * No restriction on concurrent cycles against the same address; the poller
 * simply never starts one while another is outstanding.
 */
@Slf4j
@Service
public class AcquisitionOrchestrator {

    private final ExecutorService executor;
    private final AcquisitionLeg<MainReading> mainLeg;
    private final AcquisitionLeg<CellVoltageReport> cellVoltageLeg;
    private final AcquisitionLeg<CellTemperatureReport> cellTemperatureLeg;

    @Autowired
    public AcquisitionOrchestrator(EndpointFetcher fetcher,
                                   @Qualifier("acquisitionExecutor") ExecutorService executor,
                                   SanitizerSettings sanitizer,
                                   @Value("${bms.firmware:s3}") String firmware) {
        this(executor, FirmwareProfile.byName(firmware), fetcher, sanitizer.voltagePolicy(), sanitizer.temperaturePolicy());
        log.info("Acquisition ready: firmware={} voltagePolicy={} temperaturePolicy={}",
                firmware, sanitizer.voltagePolicy(), sanitizer.temperaturePolicy());
    }

    public AcquisitionOrchestrator(ExecutorService executor, FirmwareProfile profile, EndpointFetcher fetcher,
                                   SanitizePolicy voltagePolicy, SanitizePolicy temperaturePolicy) {
        this(executor,
                new MainPanelLeg(fetcher, new PatternExtractor(), new FieldDecoder(), profile),
                new CellVoltageLeg(fetcher, new PatternExtractor(), new FieldDecoder(), profile, voltagePolicy),
                new CellTemperatureLeg(fetcher, new PatternExtractor(), new FieldDecoder(), profile, temperaturePolicy));
    }

    public AcquisitionOrchestrator(ExecutorService executor,
                                   AcquisitionLeg<MainReading> mainLeg,
                                   AcquisitionLeg<CellVoltageReport> cellVoltageLeg,
                                   AcquisitionLeg<CellTemperatureReport> cellTemperatureLeg) {
        this.executor = executor;
        this.mainLeg = mainLeg;
        this.cellVoltageLeg = cellVoltageLeg;
        this.cellTemperatureLeg = cellTemperatureLeg;
    }

    /** Launches one cycle and returns immediately. */
    public FetchRequest fetch(String address, boolean sanitize) {
        long startedAt = System.currentTimeMillis();
        Future<MainReading> m = submit(mainLeg, address, sanitize);
        Future<CellVoltageReport> cv = submit(cellVoltageLeg, address, sanitize);
        Future<CellTemperatureReport> ct = submit(cellTemperatureLeg, address, sanitize);
        if (log.isDebugEnabled()) log.debug("bms_fetch_started address={} sanitize={}", address, sanitize);
        return new FetchRequest(m, cv, ct, startedAt);
    }

    private <T> Future<T> submit(AcquisitionLeg<T> leg, String address, boolean sanitize) {
        return executor.submit(() -> {
            long t0 = System.nanoTime();
            try {
                return leg.acquire(address, sanitize);
            } catch (BmsDataException e) {
                log.debug("bms_leg_failed leg={} cause={}", leg.leg(), e.toString());
                throw e;
            } finally {
                if (log.isTraceEnabled()) {
                    log.trace("bms_leg_done leg={} tookMs={}", leg.leg(), (System.nanoTime() - t0) / 1_000_000);
                }
            }
        });
    }
}
