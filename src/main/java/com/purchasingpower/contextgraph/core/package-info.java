/**
 * Core vocabulary of the context graph: artifact types, edge types and the authority hierarchy.
 *
 * <p>Key types:
 * <ul>
 *   <li>{@code ArtifactType} - the six node types and their persisted keys</li>
 *   <li>{@code EdgeType} - typed relationships, structural and semantic</li>
 *   <li>{@code AuthorityCategory} - rank 1 (decisions) to rank 7 (pending questions)</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.contextgraph.core;
