package com.flagship.currency_gateway.store;

import lombok.Value;

/**
 * Opaque key of the latest balance document, taken from the ordered index.
 * Only compared, never interpreted.
 */
@Value(staticConstructor = "of")
public class VersionMarker {
    String dataKey;
}
