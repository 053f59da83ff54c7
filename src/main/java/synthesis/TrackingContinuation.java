package synthesis;

/**
 * Delegates to another continuation and remembers whether anything linked to
 * it, i.e. whether the construct it was handed to can complete normally.
 */
final class TrackingContinuation implements Continuation {
    private final Continuation delegate;
    private boolean used;

    TrackingContinuation(Continuation delegate) {
        this.delegate = delegate;
    }

    @Override
    public int resolve() {
        used = true;
        return delegate.resolve();
    }

    boolean isUsed() {
        return used;
    }
}
