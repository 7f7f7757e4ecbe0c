/**
 * Seams of the clipboard store.
 *
 * <p>Contains the contracts the filesystem implementation is written against so that
 * cross-process behavior can be exercised without spawning processes:
 * <ul>
 *   <li>{@link io.clipboardstore.spi.ProcessProbe} (pid, liveness, process group)</li>
 *   <li>{@link io.clipboardstore.spi.Pause} (sleep between lock polls)</li>
 *   <li>{@link io.clipboardstore.spi.ClipboardLock} and result types for lock, ignore and trim passes</li>
 * </ul>
 */
package io.clipboardstore.spi;
