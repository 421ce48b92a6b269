package io.intellixity.sqlgate.tools.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Public view of one configured database. Credentials other than the user name are never exposed. */
public record DatabaseInfo(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("type") String type,
    @JsonProperty("host") String host,
    @JsonProperty("port") Integer port,
    @JsonProperty("username") String username,
    @JsonProperty("database") String database
) {
  static final int DESCRIPTION_WIDTH = 20;

  String render() {
    String d = description == null ? "" : description;
    if (d.length() > DESCRIPTION_WIDTH) d = d.substring(0, DESCRIPTION_WIDTH - 3) + "..";
    String where = "sqlite".equals(type)
        ? (database != null ? database : name)
        : username + "@" + host + ":" + port;
    return ValueFormat.padRight(d, DESCRIPTION_WIDTH) + " " + where;
  }
}
