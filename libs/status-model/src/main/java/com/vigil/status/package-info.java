/**
 * Node and cluster health model and the cluster status aggregator.
 */
package com.vigil.status;
