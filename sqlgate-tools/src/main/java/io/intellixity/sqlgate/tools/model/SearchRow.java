package io.intellixity.sqlgate.tools.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SearchRow(
    @JsonProperty("object_type") String objectType,
    @JsonProperty("schema_name") String schemaName,
    @JsonProperty("user_friendly_descriptor") String userFriendlyDescriptor,
    @JsonProperty("data_type") String dataType
) {
  String render() {
    if ("table".equals(objectType)) return objectType + ": " + userFriendlyDescriptor;
    if (dataType != null && !"null".equals(dataType)) {
      return objectType + ": " + userFriendlyDescriptor + " (" + dataType + ") in " + schemaName;
    }
    return objectType + ": " + userFriendlyDescriptor + " in " + schemaName;
  }
}
