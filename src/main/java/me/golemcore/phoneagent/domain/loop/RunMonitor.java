package me.golemcore.phoneagent.domain.loop;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.phoneagent.domain.model.StepRecord;

import java.math.BigDecimal;

/**
 * Observer of a running {@link PhoneControlLoop}. Supplies the cooperative
 * cancellation signal and receives progress after every recorded step.
 */
public interface RunMonitor {

    RunMonitor NONE = new RunMonitor() {
        @Override
        public boolean isCancelRequested() {
            return false;
        }

        @Override
        public void onStep(StepRecord step, int inputTokens, int outputTokens, BigDecimal cost) {
            // nothing to report
        }
    };

    /**
     * Checked between iterations and before every device-mutating call.
     */
    boolean isCancelRequested();

    /**
     * Called after a step is recorded, with the run totals so far.
     */
    void onStep(StepRecord step, int inputTokens, int outputTokens, BigDecimal cost);
}
