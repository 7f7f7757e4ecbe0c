/**
 * Storage-protocol core for the clipboard store.
 *
 * <p>This module is deliberately filesystem-neutral. It contains only:
 * <ul>
 *   <li>On-disk protocol constants (directory and file names, protocol version)</li>
 *   <li>Small models: {@link io.clipboardstore.core.Namespace}, {@link io.clipboardstore.core.MetadataFile},
 *       {@link io.clipboardstore.core.RetentionPolicy}</li>
 *   <li>The {@link io.clipboardstore.core.ClipboardStoreException} hierarchy</li>
 * </ul>
 *
 * <p>The filesystem implementation lives in {@code clipboard-store-fs}.
 */
package io.clipboardstore.core;
