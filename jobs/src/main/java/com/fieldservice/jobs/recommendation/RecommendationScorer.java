package com.fieldservice.jobs.recommendation;

import com.fieldservice.jobs.entity.GeoPoint;
import com.fieldservice.jobs.entity.JobEntity;
import com.fieldservice.jobs.entity.JobPriority;
import com.fieldservice.jobs.entity.JobStatus;
import com.fieldservice.jobs.entity.TechnicianEntity;
import com.fieldservice.jobs.query.GeoDistance;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranks pending jobs for a technician. Score is skill match (up to 50) plus priority (up to 30)
 * plus proximity (up to 20, only when the technician's location is known).
 */
public class RecommendationScorer {

  static final double MAX_SKILL_SCORE = 50.0;

  /** Scores pending candidates, best first, ties broken by job id ascending */
  public List<ScoredJob> rank(TechnicianEntity technician, List<JobEntity> candidates, int max) {
    return candidates.stream()
        .filter(job -> job.status() == JobStatus.PENDING)
        .map(job -> score(technician, job))
        .sorted(
            Comparator.comparingDouble(ScoredJob::score)
                .reversed()
                .thenComparing(scored -> scored.job().jobId()))
        .limit(Math.max(max, 0))
        .collect(Collectors.toList());
  }

  public ScoredJob score(TechnicianEntity technician, JobEntity job) {
    double skill = skillScore(technician.skills(), requiredSkills(job));
    double priority = priorityScore(job.priority());

    Double distanceKm = null;
    double distance = 0;
    GeoPoint position = technician.currentLocation();
    if (position != null) {
      distanceKm = GeoDistance.toJobKm(position.latitude(), position.longitude(), job);
      if (distanceKm != null) {
        distance = distanceScore(distanceKm);
      }
    }
    return new ScoredJob(job, skill + priority + distance, skill, priority, distance, distanceKm);
  }

  static double skillScore(List<String> technicianSkills, List<String> requiredSkills) {
    Set<String> required = requiredSkills == null ? Set.of() : new HashSet<>(requiredSkills);
    if (required.isEmpty()) {
      return MAX_SKILL_SCORE;
    }
    Set<String> held = technicianSkills == null ? Set.of() : new HashSet<>(technicianSkills);
    long matched = required.stream().filter(held::contains).count();
    return MAX_SKILL_SCORE * matched / required.size();
  }

  static double priorityScore(JobPriority priority) {
    if (priority == null) {
      return 0;
    }
    return switch (priority) {
      case URGENT -> 30;
      case HIGH -> 20;
      case MEDIUM -> 10;
      case LOW -> 5;
    };
  }

  static double distanceScore(double distanceKm) {
    if (distanceKm <= 5) {
      return 20;
    } else if (distanceKm <= 10) {
      return 15;
    } else if (distanceKm <= 20) {
      return 10;
    } else if (distanceKm <= 50) {
      return 5;
    }
    return 0;
  }

  private static List<String> requiredSkills(JobEntity job) {
    return job.requirements() == null ? null : job.requirements().skills();
  }
}
