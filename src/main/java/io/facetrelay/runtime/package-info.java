/**
 * The execution unit: send and receive paths, failure recovery, provisioning and the
 * external call fallback, each running as one unit of work.
 */
package io.facetrelay.runtime;
