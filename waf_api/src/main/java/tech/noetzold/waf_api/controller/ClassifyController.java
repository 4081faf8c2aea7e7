package tech.noetzold.waf_api.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import tech.noetzold.waf_api.model.ClassificationVerdict;
import tech.noetzold.waf_api.model.ClassifyRequest;
import tech.noetzold.waf_api.model.InspectRequest;
import tech.noetzold.waf_api.model.InspectResponse;
import tech.noetzold.waf_api.service.classify.ClassificationPipeline;
import tech.noetzold.waf_api.service.classify.RawRequestFormatter;

@RestController
@RequestMapping("/v1")
@Tag(name = "Classification")
public class ClassifyController {

    private final ClassificationPipeline pipeline;

    public ClassifyController(ClassificationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping("/classify")
    public ClassificationVerdict classify(@Valid @RequestBody ClassifyRequest req) {
        return pipeline.classify(req.message());
    }

    @PostMapping("/inspect")
    public InspectResponse inspect(@RequestBody InspectRequest req) {
        return InspectResponse.fromVerdict(pipeline.classify(RawRequestFormatter.format(req)));
    }
}
