/*
 * Copyright 2019 LinkedIn Corp. Licensed under the BSD 2-Clause License (the "License"). See License in the project root for license information.
 */

package com.zabbixtools.zabbix.baseline.config;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An item filter, with the algorithm applied to the matched items and the postfix appended to their key on output.
 */
public class ItemFilter extends EntityFilter {
  private final AlgorithmConfig _algorithm;
  private final String _postfix;

  public ItemFilter(Map<String, List<String>> filter,
                    Map<String, List<String>> search,
                    AlgorithmConfig algorithm,
                    String postfix) {
    super(EntityKind.ITEM, filter, search);
    _algorithm = Objects.requireNonNull(algorithm, "algorithm cannot be null.");
    _postfix = postfix == null ? "" : postfix;
  }

  public AlgorithmConfig algorithm() {
    return _algorithm;
  }

  /**
   * @return The postfix appended to the item key of the output line, empty if none.
   */
  public String postfix() {
    return _postfix;
  }

  @Override
  public boolean equals(Object o) {
    if (!super.equals(o)) {
      return false;
    }
    ItemFilter that = (ItemFilter) o;
    return _algorithm.equals(that._algorithm) && _postfix.equals(that._postfix);
  }

  @Override
  public int hashCode() {
    return Objects.hash(super.hashCode(), _algorithm, _postfix);
  }

  @Override
  public String toString() {
    return String.format("%s{filter=%s, search=%s, algorithm=%s, postfix='%s'}",
                         kind(), filter(), search(), _algorithm, _postfix);
  }
}
