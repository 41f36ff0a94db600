package me.golemcore.phoneagent.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.phoneagent.infrastructure.config.PhoneAgentProperties;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Estimates USD cost from token counts using per-1K prices.
 */
@Service
@RequiredArgsConstructor
public class CostCalculator {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private final PhoneAgentProperties properties;

    public BigDecimal estimate(long inputTokens, long outputTokens) {
        PhoneAgentProperties.PricingProperties pricing = properties.getPricing();
        BigDecimal input = BigDecimal.valueOf(inputTokens).multiply(pricing.getInputPer1k());
        BigDecimal output = BigDecimal.valueOf(outputTokens).multiply(pricing.getOutputPer1k());
        return input.add(output)
                .divide(THOUSAND, pricing.getScale(), RoundingMode.HALF_UP);
    }
}
