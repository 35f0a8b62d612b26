package com.jobly.board.api;

import com.jobly.board.auth.Capability;
import com.jobly.board.auth.RequiresCapability;
import com.jobly.board.model.Job;
import com.jobly.board.model.JobDetail;
import com.jobly.board.model.JobListing;
import com.jobly.board.model.JobSearchCriteria;
import com.jobly.board.model.JobUpdate;
import com.jobly.board.model.NewJob;
import com.jobly.board.service.JobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/jobs")
public class JobController {
    private final JobService jobService;
    private final RequestValidator validator;

    public JobController(JobService jobService, RequestValidator validator) {
        this.jobService = jobService;
        this.validator = validator;
    }

    @PostMapping
    @RequiresCapability(Capability.ADMIN)
    public ResponseEntity<Map<String, Job>> create(@RequestBody NewJob job) {
        Job created = jobService.create(validator.validate(job));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("job", created));
    }

    /** {@code hasEquity} filters only when the query value is the literal {@code true}. */
    @GetMapping
    public Map<String, List<JobListing>> findAll(
        @RequestParam(name = "minSalary", required = false) Integer minSalary,
        @RequestParam(name = "hasEquity", required = false) String hasEquity,
        @RequestParam(name = "title", required = false) String title
    ) {
        JobSearchCriteria criteria = validator.validate(
            new JobSearchCriteria(minSalary, "true".equals(hasEquity), title)
        );
        return Map.of("jobs", jobService.findAll(criteria));
    }

    @GetMapping("/{id}")
    public Map<String, JobDetail> get(@PathVariable("id") long id) {
        return Map.of("job", jobService.get(id));
    }

    @PatchMapping("/{id}")
    @RequiresCapability(Capability.ADMIN)
    public Map<String, Job> update(@PathVariable("id") long id, @RequestBody JobUpdate update) {
        return Map.of("job", jobService.update(id, validator.validate(update)));
    }

    @DeleteMapping("/{id}")
    @RequiresCapability(Capability.ADMIN)
    public Map<String, Long> delete(@PathVariable("id") long id) {
        jobService.remove(id);
        return Map.of("deleted", id);
    }
}
