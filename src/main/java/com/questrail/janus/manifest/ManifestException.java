package com.questrail.janus.manifest;

import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.JanusException;

/**
 * A manifest could not be read or is internally inconsistent. Surfaces as a
 * {@link ErrorCode#CONFIGURATION_ERROR}.
 */
public final class ManifestException extends JanusException
{
    public ManifestException(String details) {
        super(ErrorCode.CONFIGURATION_ERROR, details);
    }

    public ManifestException(String details, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, details, cause);
    }
}
