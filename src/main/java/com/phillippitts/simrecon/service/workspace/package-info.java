/**
 * Ownership of temporary directories.
 *
 * <p>{@link com.phillippitts.simrecon.service.workspace.TemporaryWorkspace} is the per-job
 * scratch directory with explicit and implicit (Cleaner-driven, warned) cleanup.
 * {@link com.phillippitts.simrecon.service.workspace.EmptyDirectoryGuard} tidies directories the
 * application created but never filled, and leaves caller-supplied directories alone.
 *
 * @since 1.0
 */
package com.phillippitts.simrecon.service.workspace;
