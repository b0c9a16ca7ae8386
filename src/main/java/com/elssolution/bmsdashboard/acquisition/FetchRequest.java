package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.domain.CellTemperatureReport;
import com.elssolution.bmsdashboard.domain.CellVoltageReport;
import com.elssolution.bmsdashboard.domain.MainReading;
import com.elssolution.bmsdashboard.domain.Snapshot;
import com.elssolution.bmsdashboard.error.AcquisitionException;
import com.elssolution.bmsdashboard.error.BmsDataException;
import com.elssolution.bmsdashboard.error.FetchFailedException;
import com.elssolution.bmsdashboard.error.UnexpectedFailureException;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one in-flight poll cycle (three legs).
 *
 * {@link #isFinished()} may be called from any thread at any rate; it only reads
 * the legs' own completion state. {@link #join()} may be called exactly once.
 * Dropping the handle without joining leaves the legs to finish on their own.
 */
public final class FetchRequest {

    private final Future<MainReading> main;
    private final Future<CellVoltageReport> cellVoltage;
    private final Future<CellTemperatureReport> cellTemperature;
    private final long startedAtMs;
    private final AtomicBoolean joined = new AtomicBoolean(false);

    FetchRequest(Future<MainReading> main,
                 Future<CellVoltageReport> cellVoltage,
                 Future<CellTemperatureReport> cellTemperature,
                 long startedAtMs) {
        this.main = main;
        this.cellVoltage = cellVoltage;
        this.cellTemperature = cellTemperature;
        this.startedAtMs = startedAtMs;
    }

    /** True once every leg has completed, successfully or not. Never blocks. */
    public boolean isFinished() {
        return main.isDone() && cellVoltage.isDone() && cellTemperature.isDone();
    }

    public long getStartedAtMs() {
        return startedAtMs;
    }

    /**
     * Waits for every leg to complete, then assembles the snapshot. A failing leg
     * never cuts the wait short; the failure is reported once all legs are settled.
     *
     * @throws FetchFailedException       first leg (in main, voltage, temperature order)
     *                                    that reported a controller or network fault
     * @throws UnexpectedFailureException first leg whose worker crashed
     * @throws IllegalStateException      if already joined
     */
    public Snapshot join() throws AcquisitionException {
        if (!joined.compareAndSet(false, true)) {
            throw new IllegalStateException("fetch request already joined");
        }
        Outcome<MainReading> m = settle(Leg.MAIN_PANEL, main);
        Outcome<CellVoltageReport> cv = settle(Leg.CELL_VOLTAGE, cellVoltage);
        Outcome<CellTemperatureReport> ct = settle(Leg.CELL_TEMPERATURE, cellTemperature);
        return new Snapshot(m.get(), cv.get(), ct.get(), System.currentTimeMillis());
    }

    private static <T> Outcome<T> settle(Leg leg, Future<T> f) {
        try {
            return new Outcome<>(f.get(), null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof BmsDataException bde) {
                return new Outcome<>(null, new FetchFailedException(leg, bde));
            }
            return new Outcome<>(null, new UnexpectedFailureException(leg, cause));
        } catch (CancellationException e) {
            return new Outcome<>(null, new UnexpectedFailureException(leg, e));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return new Outcome<>(null, new UnexpectedFailureException(leg, ie));
        }
    }

    /** Result or failure of one leg. */
    private record Outcome<T>(T value, AcquisitionException failure) {
        T get() throws AcquisitionException {
            if (failure != null) throw failure;
            return value;
        }
    }
}
