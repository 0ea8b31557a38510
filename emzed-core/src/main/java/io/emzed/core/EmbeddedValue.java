package io.emzed.core;

/**
 * Contract for domain objects stored in table cells (spectra, peak maps, blobs).
 * The table engine never looks into their structure; it copies them, compares them and
 * folds their {@link #uniqueId()} into table digests.
 * <p>
 * Implementations must also implement {@code equals}/{@code hashCode} by value.
 * To be written by {@link io.emzed.storage.TableStore} they must be {@link java.io.Serializable}.
 */
public interface EmbeddedValue extends ContentHashable {

    EmbeddedValue copy();
}
