package tech.ochestra.kubecostguard.adapters;

import tech.ochestra.kubecostguard.service.EvaluationReport;

/**
 * Receives the report of every completed monitoring cycle, e.g. to export
 * metrics or write report files.
 */
public interface EvaluationReportListener {

    void onReport(EvaluationReport report);
}
