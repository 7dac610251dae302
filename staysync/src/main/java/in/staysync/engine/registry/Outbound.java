package in.staysync.engine.registry;

/**
 * Something a broadcast can render per connection filter.
 */
@FunctionalInterface
public interface Outbound {

    /**
     * @param propertyFilter the connection's property filter, null for unfiltered
     * @return the view for that filter, or null when nothing matches
     */
    OutboundView viewFor(Long propertyFilter);

    /**
     * Narrow to the events sequenced after {@code seq}. Messages that carry no events are
     * returned unchanged.
     */
    default Outbound after(long seq) {
        return this;
    }

    static Outbound of(OutboundView view) {
        return filter -> view;
    }
}
