package in.staysync.engine.registry;

import in.staysync.domain.stream.StreamMessage;

/**
 * A message rendered for one property filter, with the number of events it carries.
 */
public record OutboundView(StreamMessage message, int eventCount) {}
