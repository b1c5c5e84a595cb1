package com.canary.intel.store;

import com.canary.intel.model.FalsePositive;
import com.canary.intel.model.MissedSignal;

import java.sql.SQLException;

/**
 * User-reported false positives and missed signals.
 */
public interface ErrorReportRepo {

    void saveFalsePositive(FalsePositive falsePositive) throws SQLException;

    void saveMissedSignal(MissedSignal missedSignal) throws SQLException;

    int countFalsePositives() throws SQLException;

    int countMissedSignals() throws SQLException;
}
