package com.cricket.live.service;

import com.cricket.live.model.Innings;
import com.cricket.live.model.MatchSnapshot;
import com.cricket.live.model.Team;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class TeamOversAnnotator {
  static final String NO_OVERS = "0.0";

  // Overs each team has faced come from the first innings it batted.
  public MatchSnapshot annotateOvers(MatchSnapshot snapshot) {
    Map<String, String> overs = new HashMap<>();
    for (Team team : snapshot.getMatch().getTeams()) {
      if (team.getId() == null) {
        continue;
      }
      String teamOvers =
          snapshot
              .getScorecard()
              .flatMap(scorecard -> scorecard.firstInningsBattedBy(team.getId()))
              .map(Innings::getOversBowled)
              .orElse(NO_OVERS);
      overs.put(team.getId(), teamOvers);
    }
    return snapshot.withOvers(overs);
  }
}
