/*
 * Copyright The OpenZipkin Authors
 * SPDX-License-Identifier: Apache-2.0
 */
package tracestore.elasticsearch;

import java.io.IOException;
import java.util.logging.Logger;
import tracestore.metrics.StorageMetrics;
import zipkin2.Call;

import static tracestore.elasticsearch.IndexNameResolver.normalizePrefix;

/**
 * Installs the index templates before anything is written. Templates are put unconditionally,
 * relying on Elasticsearch to overwrite an existing template of the same name.
 */
public final class TemplateBootstrapper {
  static final String SPAN_TEMPLATE = "tracestore-span", SERVICE_TEMPLATE = "tracestore-service";

  final ElasticsearchClient client;
  final StorageMetrics metrics;
  final Logger logger;

  TemplateBootstrapper(ElasticsearchClient client, StorageMetrics metrics) {
    this(client, metrics, Logger.getLogger(TemplateBootstrapper.class.getName()));
  }

  TemplateBootstrapper(ElasticsearchClient client, StorageMetrics metrics, Logger logger) {
    this.client = client;
    this.metrics = metrics.forOperation(ElasticsearchSpanWriter.INDEX_CREATE);
    this.logger = logger;
  }

  /**
   * Puts the span template, then the service template. This is a blocking call, as no writes
   * should occur until the templates are available. When the span template fails, the service
   * template is not attempted.
   *
   * @param indexPrefix empty or a prefix like "prod", which becomes "prod-tracestore-span"
   */
  public void createTemplates(String spanTemplate, String serviceTemplate, String indexPrefix)
    throws IOException {
    if (spanTemplate == null) throw new NullPointerException("spanTemplate == null");
    if (serviceTemplate == null) throw new NullPointerException("serviceTemplate == null");
    String prefix = normalizePrefix(indexPrefix);
    putTemplate(prefix + SPAN_TEMPLATE, spanTemplate);
    putTemplate(prefix + SERVICE_TEMPLATE, serviceTemplate);
  }

  void putTemplate(String name, String body) throws IOException {
    metrics.incrementAttempts();
    try {
      client.putTemplate(name, body).execute();
    } catch (IOException | RuntimeException | Error e) {
      Call.propagateIfFatal(e);
      metrics.incrementErrors();
      throw e;
    }
    metrics.incrementInserts();
    logger.info("installed index template " + name);
  }

  @Override public String toString() {
    return "TemplateBootstrapper{" + client + "}";
  }
}
