package com.edge.precision.config;

import com.edge.precision.core.calibration.ScaleCalibrator;
import com.edge.precision.core.distance.DistanceFieldBuilder;
import com.edge.precision.core.distance.NearestNeighborValidator;
import com.edge.precision.core.extract.ContourExtractor;
import com.edge.precision.core.extract.ThresholdContourExtractor;
import com.edge.precision.core.registration.AxisFallbackGenerator;
import com.edge.precision.core.registration.FeatureHomographyGenerator;
import com.edge.precision.core.registration.IdentityGenerator;
import com.edge.precision.core.registration.IntensityAlignmentGenerator;
import com.edge.precision.core.registration.RegistrationChain;
import com.edge.precision.core.registration.RegistrationGenerator;
import com.edge.precision.core.registration.RegistrationSelector;
import com.edge.precision.core.resample.ContourResampler;
import com.edge.precision.core.tau.LabeledTauCalibrator;
import com.edge.precision.core.tau.ReportLoader;
import com.edge.precision.core.tau.ReportPathCollector;
import com.edge.precision.core.tau.TargetTauCalibrator;
import com.edge.precision.core.tau.TauCurveExporter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * 核心组件装配
 * <p>
 * 从 application.yml 读取配置并注入到各算法组件
 */
@Configuration
public class PrecisionComponentConfig {
    private static final Logger logger = LoggerFactory.getLogger(PrecisionComponentConfig.class);

    @Autowired
    private PrecisionConfig precisionConfig;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public ContourResampler contourResampler() {
        return new ContourResampler();
    }

    @Bean
    public ContourExtractor contourExtractor() {
        return new ThresholdContourExtractor(precisionConfig.getExtraction());
    }

    @Bean
    public DistanceFieldBuilder distanceFieldBuilder() {
        return new DistanceFieldBuilder(precisionConfig.getDistance().getDrawThickness());
    }

    @Bean
    public NearestNeighborValidator nearestNeighborValidator() {
        return new NearestNeighborValidator();
    }

    /**
     * 按优先级排列的配准生成器，恒等变换总在最后
     */
    @Bean
    public RegistrationChain registrationChain() {
        PrecisionConfig.RegistrationConfig registration = precisionConfig.getRegistration();
        List<RegistrationGenerator> generators = new ArrayList<>();
        if (registration.isUseFeatureHomography()) {
            generators.add(new FeatureHomographyGenerator(registration));
        }
        if (registration.isUseAxesFallback()) {
            generators.add(new AxisFallbackGenerator(registration));
        }
        if (registration.isUseEccFallback()) {
            generators.add(new IntensityAlignmentGenerator(registration));
        }
        generators.add(new IdentityGenerator());
        logger.info("Registration generators: {}", generators.stream().map(g -> g.getMethod().getCode()).toList());
        return new RegistrationChain(generators);
    }

    @Bean
    public RegistrationSelector registrationSelector() {
        return new RegistrationSelector(precisionConfig.getDistance().isUseBilinear());
    }

    @Bean
    public ScaleCalibrator scaleCalibrator() {
        return new ScaleCalibrator(precisionConfig.getCalibration());
    }

    @Bean
    public ReportPathCollector reportPathCollector() {
        return new ReportPathCollector();
    }

    @Bean
    public ReportLoader reportLoader(ObjectMapper objectMapper) {
        return new ReportLoader(objectMapper);
    }

    @Bean
    public TargetTauCalibrator targetTauCalibrator() {
        return new TargetTauCalibrator();
    }

    @Bean
    public LabeledTauCalibrator labeledTauCalibrator() {
        return new LabeledTauCalibrator();
    }

    @Bean
    public TauCurveExporter tauCurveExporter() {
        return new TauCurveExporter();
    }
}
