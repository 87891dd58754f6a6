package com.moosivp.analyzer;

import com.moosivp.analyzer.config.AnalyzerProperties;
import com.moosivp.analyzer.dto.AnalysisRequest;
import com.moosivp.analyzer.dto.CompletionContext;
import com.moosivp.analyzer.model.AnalysisResult;
import com.moosivp.analyzer.model.FileType;
import com.moosivp.analyzer.preprocess.IncludeResolver;
import com.moosivp.analyzer.service.CompletionService;
import com.moosivp.analyzer.service.EditorViewService;
import com.moosivp.analyzer.service.MoosAnalysisService;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = "moos.analyzer.max-include-depth=8")
public class MoosAnalyzerApplicationTest {

    @Autowired
    private AnalyzerProperties properties;

    @Autowired
    private MoosAnalysisService analysisService;

    @Autowired
    private EditorViewService editorViewService;

    @Autowired
    private CompletionService completionService;

    @Test
    public void bindsProperties() {
        assertEquals(8, properties.maxIncludeDepth());
        assertTrue(properties.substituteInQuotes());
        assertEquals(1_048_576, properties.maxSourceLength());
    }

    @Test
    public void servicesWorkTogether() {
        String source = "ProcessConfig = uMS\n{\n  AppTick = 4\n}\n#";
        AnalysisResult result = analysisService.analyze(AnalysisRequest.of(source, FileType.MISSION),
                IncludeResolver.NONE);

        assertEquals(1, editorViewService.inlayHints(result).size());
        assertEquals(CompletionContext.DIRECTIVE,
                completionService.complete(result, source.length(), IncludeResolver.NONE).context());
    }

    @Test
    public void rejectsNullSource() {
        AnalysisRequest request = new AnalysisRequest(null, FileType.MISSION, null);
        assertThrows(ConstraintViolationException.class,
                () -> analysisService.analyze(request, IncludeResolver.NONE));
    }
}
