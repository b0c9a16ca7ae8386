package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.domain.MainReading;
import com.elssolution.bmsdashboard.error.BmsDataException;
import lombok.extern.slf4j.Slf4j;

import static com.elssolution.bmsdashboard.acquisition.FirmwareProfile.*;

/** Pack-level scalars from the main data page. Nothing to sanitize here. */
@Slf4j
public class MainPanelLeg implements AcquisitionLeg<MainReading> {

    private final EndpointFetcher fetcher;
    private final PatternExtractor extractor;
    private final FieldDecoder decoder;
    private final FirmwareProfile profile;

    public MainPanelLeg(EndpointFetcher fetcher, PatternExtractor extractor,
                        FieldDecoder decoder, FirmwareProfile profile) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.decoder = decoder;
        this.profile = profile;
    }

    @Override
    public Leg leg() {
        return Leg.MAIN_PANEL;
    }

    @Override
    public MainReading acquire(String address, boolean sanitize) throws BmsDataException {
        String body = fetcher.fetch(address, profile.mainResource());
        DecodePlan plan = profile.mainPlan();
        DecodedFields f = decoder.decode(extractor.extract(body, plan.key()), plan);

        MainReading r = new MainReading(
                f.decimal(VOLTAGE),
                f.decimal(CURRENT),
                f.decimal(STATE_OF_CHARGE),
                f.decimal(TEMP_AVG),
                f.decimal(TEMP_MIN),
                f.decimal(TEMP_MAX),
                f.decimal(TEMP_MASTER));
        if (log.isDebugEnabled()) log.debug("bms_main_ok {}", r);
        return r;
    }
}
