package com.elssolution.bmsdashboard.acquisition;

import com.elssolution.bmsdashboard.error.BodyDecodeException;
import com.elssolution.bmsdashboard.error.TransportException;

/**
 * One blocking GET of a controller sub-resource. The only I/O boundary of
 * the pipeline. Implementations do not retry.
 */
public interface EndpointFetcher {

    /**
     * @param address  controller host or host:port, optionally with scheme
     * @param resource page name, e.g. {@code ucell.shtml}
     * @return response body as text
     */
    String fetch(String address, String resource) throws TransportException, BodyDecodeException;
}
