/**
 * Cluster membership for the Vigil agent.
 *
 * <p>The agent does not implement gossip. It consumes a {@link com.vigil.membership.GossipSubstrate}
 * (JGroups in a cluster, {@link com.vigil.membership.standalone.StandaloneGossipSubstrate} for a single node,
 * {@link com.vigil.membership.testing.InMemoryGossipSubstrate} in tests)
 * through a {@link com.vigil.membership.MembershipClient} that exposes only active members:
 *
 * <ul>
 *   <li>{@code Members()} → {@link com.vigil.membership.MembershipClient#members()}
 *   <li>{@code FindMember(name)} → {@link com.vigil.membership.MembershipClient#findMember(String)}
 *   <li>{@code Join(peers, replay)} → {@link com.vigil.membership.MembershipClient#join}
 *   <li>{@code UpdateTags} → {@link com.vigil.membership.MembershipClient#updateTags}
 *   <li>{@code GetCoordinate(node)} → {@link com.vigil.membership.MembershipClient#coordinate(String)}
 * </ul>
 */
package com.vigil.membership;
