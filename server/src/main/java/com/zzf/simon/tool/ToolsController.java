package com.zzf.simon.tool;

import com.zzf.simon.infrastructure.CallerContext;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/tools")
@RequiredArgsConstructor
public class ToolsController {
    private final ToolRunService toolRunService;
    private final ToolRegistry registry;

    @GetMapping
    public List<ToolDefinition> list() {
        return registry.list();
    }

    @PostMapping("/execute")
    public ExecuteToolResponse execute(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid,
                                       @RequestBody ExecuteToolRequest request) {
        return toolRunService.execute(uid, request);
    }

    @PostMapping("/result")
    public Map<String, String> result(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid,
                                      @RequestBody ToolResultRequest request) {
        toolRunService.report(uid, request);
        return Map.of("status", "updated");
    }

    @GetMapping("/runs/{id}")
    public ToolRun get(@RequestAttribute(CallerContext.UID_ATTRIBUTE) String uid, @PathVariable("id") String id) {
        return toolRunService.get(uid, id);
    }
}
