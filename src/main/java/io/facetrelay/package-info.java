/**
 * FacetRelay source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.facetrelay.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.facetrelay.cli.FacetRelayCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.facetrelay.runtime.FacetRelayRuntime} owns the send, receive and recovery paths.</li>
 *   <li>{@code io.facetrelay.facet.DispatchTable} routes call data to facets by selector.</li>
 * </ul>
 */
package io.facetrelay;
