package com.homeostat.core.policy;

/**
 * How a rule combines its conditions.
 */
public enum Combinator {
    ANY,
    ALL
}
