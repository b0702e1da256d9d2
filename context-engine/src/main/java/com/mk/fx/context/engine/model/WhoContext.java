package com.mk.fx.context.engine.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Parties, judges, attorneys and witnesses of a case. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WhoContext implements DimensionContext {
  private String caseId;
  private String caseName;
  @Builder.Default private List<Party> parties = new ArrayList<>();
  @Builder.Default private List<Judge> judges = new ArrayList<>();
  @Builder.Default private List<Attorney> attorneys = new ArrayList<>();
  @Builder.Default private List<Witness> witnesses = new ArrayList<>();

  /** Source node id to the node ids it is related to. */
  @Builder.Default private Map<String, List<String>> partyRelationships = new LinkedHashMap<>();

  /** Party id to the id of the attorney representing it. */
  @Builder.Default private Map<String, String> representationMap = new LinkedHashMap<>();

  public static WhoContext empty(String caseId) {
    return WhoContext.builder()
        .caseId(caseId)
        .caseName(DimensionContext.defaultCaseName(caseId))
        .build();
  }

  public int partyCount() {
    return parties.size();
  }

  public List<Party> partiesByRole(String role) {
    var wanted = PartyRole.fromValue(role);
    return parties.stream().filter(p -> p.getRole() == wanted).collect(Collectors.toList());
  }

  public int dataPoints() {
    return parties.size() + judges.size() + attorneys.size() + witnesses.size();
  }
}
