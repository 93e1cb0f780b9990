package eryxon.qrm.cache;

import java.util.function.Function;

/**
 * What a consumer sees for one key.
 *
 * {@code value} is the last good snapshot and survives failed recomputes;
 * {@code error} belongs to the last recompute; {@code channelError} is set while
 * the change-event channel is unhealthy and live updates may be missing.
 */
public record SnapshotState<V>(
        LoadState status,
        V value,
        Throwable error,
        Throwable channelError,
        long generation) {

    public static <V> SnapshotState<V> empty() {
        return new SnapshotState<>(LoadState.EMPTY, null, null, null, 0);
    }

    public boolean isLoading() {
        return status == LoadState.LOADING;
    }

    public boolean hasValue() {
        return value != null;
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean isChannelHealthy() {
        return channelError == null;
    }

    /**
     * The same state with its value converted; a missing value stays missing.
     */
    public <W> SnapshotState<W> map(Function<? super V, ? extends W> mapper) {
        W mapped = value == null ? null : mapper.apply(value);
        return new SnapshotState<>(status, mapped, error, channelError, generation);
    }

    SnapshotState<V> loading(long dispatched) {
        return new SnapshotState<>(LoadState.LOADING, value, error, channelError, dispatched);
    }

    SnapshotState<V> ready(V newValue) {
        return new SnapshotState<>(LoadState.READY, newValue, null, channelError, generation);
    }

    SnapshotState<V> failed(Throwable newError) {
        return new SnapshotState<>(LoadState.FAILED, value, newError, channelError, generation);
    }

    SnapshotState<V> withChannelError(Throwable newChannelError) {
        return new SnapshotState<>(status, value, error, newChannelError, generation);
    }
}
