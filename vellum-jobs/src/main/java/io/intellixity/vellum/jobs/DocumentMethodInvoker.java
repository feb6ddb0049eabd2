package io.intellixity.vellum.jobs;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads a document and calls one of its methods. Backs the built-in
 * {@value #RUN_DOCUMENT_METHOD} target used by {@link JobDispatcher#enqueueForDocument}.
 */
@FunctionalInterface
public interface DocumentMethodInvoker {
  String RUN_DOCUMENT_METHOD = "vellum.jobs.run_document_method";

  String ENTITY_TYPE = "entity_type";
  String NAME = "name";
  String DOC_METHOD = "doc_method";

  Object invoke(String entityType, String name, String method, Map<String, Object> kwargs) throws Exception;

  /** Target adapter: splits the document coordinates off the keyword arguments. */
  default Object run(Map<String, Object> kwargs) throws Exception {
    Map<String, Object> rest = new LinkedHashMap<>(kwargs);
    Object entityType = rest.remove(ENTITY_TYPE);
    Object name = rest.remove(NAME);
    Object method = rest.remove(DOC_METHOD);
    if (entityType == null || method == null) {
      throw new IllegalArgumentException("entity_type and doc_method are required");
    }
    return invoke(entityType.toString(), name == null ? null : name.toString(), method.toString(), rest);
  }
}
