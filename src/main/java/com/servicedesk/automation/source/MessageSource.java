package com.servicedesk.automation.source;

import com.servicedesk.automation.exception.MessageSourceException;
import com.servicedesk.automation.model.RawMessage;

import java.util.List;

/**
 * Where support emails come from. Implementations may return messages already seen;
 * ingestion deduplicates by fingerprint.
 */
public interface MessageSource {

    /**
     * @throws MessageSourceException when the source cannot be read at all
     */
    List<RawMessage> fetch();

    String describe();
}
