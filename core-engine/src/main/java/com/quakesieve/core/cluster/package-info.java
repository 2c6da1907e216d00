/**
 * Declustering engines.
 *
 * <p>
 * {@link com.quakesieve.core.cluster.WindowDeclusterer} implements the
 * magnitude-ordered Gardner-Knopoff family over any
 * {@link com.quakesieve.core.window.WindowModel};
 * {@link com.quakesieve.core.cluster.ReasenbergDeclusterer} implements
 * adaptive interaction clustering. Both are created from configuration by
 * {@link com.quakesieve.core.cluster.DeclustererFactory}.
 * </p>
 *
 * @since 1.0.0
 */
package com.quakesieve.core.cluster;
