/**
 * REST API for syncing and querying the knowledge graph.
 *
 * @since 1.0.0
 */
package com.purchasingpower.contextgraph.api;
