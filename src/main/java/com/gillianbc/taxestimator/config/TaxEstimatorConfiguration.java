package com.gillianbc.taxestimator.config;

import com.gillianbc.taxestimator.model.TaxYearConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
@EnableConfigurationProperties(TaxYearProperties.class)
public class TaxEstimatorConfiguration {

    @Bean
    public TaxYearConfig taxYearConfig(TaxYearProperties properties) {
        TaxYearConfig taxYear = properties.toTaxYearConfig();
        log.info("Tax year {} to {}: allowance {}, taper {}-{}, band tables {} (default {})",
                taxYear.getStartDate(), taxYear.getEndDate(), taxYear.getPersonalAllowance(),
                taxYear.getTaperThreshold(), taxYear.getTaperLimit(), taxYear.getBandTables().keySet(),
                taxYear.getDefaultBandTable());
        return taxYear;
    }

    @Bean
    public Clock clock(TaxYearProperties properties) {
        return Clock.system(ZoneId.of(properties.zone()));
    }
}
