/**
 * Filesystem implementation of the clipboard store.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.clipboardstore.fs.ClipboardStore} (entry point built from {@link io.clipboardstore.fs.StoreSettings})</li>
 *   <li>{@link io.clipboardstore.fs.Clipboard} (handle over one clipboard root and its {@link io.clipboardstore.fs.EntryIndex})</li>
 *   <li>{@link io.clipboardstore.fs.PidFileLock} (pid-record lock with process-group re-entry)</li>
 *   <li>{@link io.clipboardstore.fs.IgnoreEngine} and {@link io.clipboardstore.fs.RetentionManager} (passes over entries)</li>
 * </ul>
 *
 * <p>Independent processes coordinate only through file presence, directory listings and the lock
 * record. Nothing here starts threads.
 */
package io.clipboardstore.fs;
