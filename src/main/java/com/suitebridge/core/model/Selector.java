package com.suitebridge.core.model;

import java.io.Serializable;

/**
 * Narrows what part of a suite a run request asks for.
 * <p>
 * Selectors within one request are OR-ed; an empty selector list means the entire suite.
 */
public sealed interface Selector extends Serializable
        permits SuiteSelector, TestSelector, TestWildcardSelector, NestedSuiteSelector, NestedTestSelector {
}
