package org.calista.arasaka.tot.search.collaborator;

import java.util.List;

/**
 * Produces candidate next steps for a line of reasoning.
 *
 * <h3>Contract</h3>
 * - returns 0..{@code request.count} contents; fewer is valid, surplus is truncated by the caller
 * - blank contents are dropped by the caller
 * - may throw on failure; the caller retries per its call policy
 * - non-idempotent: a retry may return different content, so committed results are never re-requested
 */
public interface BranchGenerator {

    List<String> generate(GenerationRequest request);
}
