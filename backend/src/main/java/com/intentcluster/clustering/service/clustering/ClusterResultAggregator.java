package com.intentcluster.clustering.service.clustering;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.springframework.stereotype.Service;

/**
 * Groups utterances by cluster label. Groups come out in ascending label order, so the noise
 * group ({@code -1}) is first whenever it exists. Members keep their input order.
 */
@Service
public class ClusterResultAggregator {

  public LinkedHashMap<Integer, List<String>> aggregate(
      List<String> utterances, ClusterAssignment assignment) {
    if (utterances.size() != assignment.size()) {
      throw new IllegalArgumentException(
          "Got "
              + utterances.size()
              + " utterances but "
              + assignment.size()
              + " cluster labels");
    }

    LinkedHashMap<Integer, List<String>> groups = new LinkedHashMap<>();
    for (Map.Entry<Integer, List<Integer>> entry : groupIndices(assignment).entrySet()) {
      List<String> members = new ArrayList<>(entry.getValue().size());
      for (int index : entry.getValue()) {
        members.add(utterances.get(index));
      }
      groups.put(entry.getKey(), members);
    }
    return groups;
  }

  /** Same grouping as {@link #aggregate}, but of utterance positions. */
  public LinkedHashMap<Integer, List<Integer>> groupIndices(ClusterAssignment assignment) {
    TreeMap<Integer, List<Integer>> sorted = new TreeMap<>();
    for (int i = 0; i < assignment.size(); i++) {
      sorted.computeIfAbsent(assignment.labelOf(i), label -> new ArrayList<>()).add(i);
    }
    return new LinkedHashMap<>(sorted);
  }
}
