package com.jobly.board.service;

import com.jobly.board.error.NotFoundException;
import com.jobly.board.model.Company;
import com.jobly.board.model.Job;
import com.jobly.board.model.JobDetail;
import com.jobly.board.model.JobListing;
import com.jobly.board.model.JobSearchCriteria;
import com.jobly.board.model.JobUpdate;
import com.jobly.board.model.NewJob;
import com.jobly.board.persistence.CompanyJdbcRepository;
import com.jobly.board.persistence.JobJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class JobService {
    private static final Logger log = LoggerFactory.getLogger(JobService.class);
    private final JobJdbcRepository jobs;
    private final CompanyJdbcRepository companies;

    public JobService(JobJdbcRepository jobs, CompanyJdbcRepository companies) {
        this.jobs = jobs;
        this.companies = companies;
    }

    @Transactional
    public Job create(NewJob job) {
        if (!companies.existsByHandle(job.companyHandle())) {
            throw new NotFoundException("No company: " + job.companyHandle());
        }
        Job created = jobs.insert(job);
        log.info("Created job {} for company {}", created.id(), created.companyHandle());
        return created;
    }

    /** Jobs matching every supplied filter, ordered by title. No salary range check is applied. */
    public List<JobListing> findAll(JobSearchCriteria criteria) {
        return jobs.findAll(criteria);
    }

    public JobDetail get(long id) {
        Job job = jobs.findById(id);
        if (job == null) {
            throw new NotFoundException("No job: " + id);
        }
        Company company = companies.findByHandle(job.companyHandle());
        return JobDetail.of(job, company);
    }

    public Job update(long id, JobUpdate update) {
        Job job = jobs.update(id, update.toUpdateSpec());
        if (job == null) {
            throw new NotFoundException("No job: " + id);
        }
        log.info("Updated job {}", id);
        return job;
    }

    public void remove(long id) {
        if (!jobs.delete(id)) {
            throw new NotFoundException("No job: " + id);
        }
        log.info("Removed job {}", id);
    }
}
