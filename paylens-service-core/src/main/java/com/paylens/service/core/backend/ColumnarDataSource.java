package com.paylens.service.core.backend;

/** Columnar store. Only this kind of store holds the SDK, API and active-payment event streams. */
public interface ColumnarDataSource extends AnalyticsDataSource {}
