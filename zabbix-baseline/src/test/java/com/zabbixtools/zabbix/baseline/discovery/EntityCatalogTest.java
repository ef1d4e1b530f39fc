/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.discovery;

import java.util.Arrays;
import java.util.Set;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class EntityCatalogTest {

  @Test
  public void testDuplicateIdsAreKeptOnce() {
    EntityCatalog<String> hosts = new EntityCatalog<>("host");
    assertTrue(hosts.put("10084", "web1"));
    assertTrue(hosts.put("10085", "web2"));
    assertFalse(hosts.put("10084", "web1"));

    assertEquals(2, hosts.size());
    assertEquals(Arrays.asList("10084", "10085"), Arrays.asList(hosts.ids().toArray()));
    assertEquals("web1", hosts.get("10084"));
  }

  @Test
  public void testSnapshotWhileOpen() {
    EntityCatalog<String> hosts = new EntityCatalog<>("host");
    hosts.put("10084", "web1");
    Set<String> ids = hosts.ids();
    hosts.put("10085", "web2");

    assertEquals(1, ids.size());
    assertEquals(2, hosts.ids().size());
  }

  @Test(expected = IllegalStateException.class)
  public void testFrozenCatalogRejectsInsertion() {
    EntityCatalog<String> templates = new EntityCatalog<>("template");
    templates.put("10001", "Template OS Linux");
    templates.freeze();
    templates.freeze();

    assertTrue(templates.isFrozen());
    assertTrue(templates.contains("10001"));
    templates.put("10002", "Template App Nginx");
  }

  @Test(expected = UnsupportedOperationException.class)
  public void testFrozenViewIsReadOnly() {
    EntityCatalog<String> templates = new EntityCatalog<>("template");
    templates.put("10001", "Template OS Linux");
    templates.freeze();

    templates.entries().put("10002", "Template App Nginx");
  }
}
