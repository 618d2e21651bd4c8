package com.GlobeLine.series_cache.exception;

/**
 * The upstream payload does not follow the SDMX-JSON structure we decode.
 * Carries a short reference to the raw payload so the log entry can be found again.
 */
public class MalformedResponseException extends UpstreamException {

	private final String payloadReference;

	public MalformedResponseException(String seriesKey, String message, String payloadReference) {
		this(seriesKey, message, payloadReference, null);
	}

	public MalformedResponseException(String seriesKey, String message, String payloadReference, Throwable cause) {
		super(seriesKey, "Malformed response for series " + seriesKey + ": " + message, cause);
		this.payloadReference = payloadReference;
	}

	public String getPayloadReference() {
		return payloadReference;
	}

	@Override
	public boolean isTransient() {
		return false;
	}
}
