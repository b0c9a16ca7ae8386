package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.error.BmsDataException;

/**
 * One fetch-extract-decode-[sanitize]-aggregate pipeline. Implementations keep
 * no state between calls, so one instance may run in several cycles at once.
 */
public interface AcquisitionLeg<T> {

    Leg leg();

    T acquire(String address, boolean sanitize) throws BmsDataException;
}
