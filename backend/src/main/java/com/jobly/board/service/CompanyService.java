package com.jobly.board.service;

import com.jobly.board.error.NotFoundException;
import com.jobly.board.error.ValidationException;
import com.jobly.board.model.Company;
import com.jobly.board.model.CompanyDetail;
import com.jobly.board.model.CompanySearchCriteria;
import com.jobly.board.model.CompanyUpdate;
import com.jobly.board.model.NewCompany;
import com.jobly.board.persistence.CompanyJdbcRepository;
import com.jobly.board.persistence.JobJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class CompanyService {
    private static final Logger log = LoggerFactory.getLogger(CompanyService.class);
    private final CompanyJdbcRepository companies;
    private final JobJdbcRepository jobs;

    public CompanyService(CompanyJdbcRepository companies, JobJdbcRepository jobs) {
        this.companies = companies;
        this.jobs = jobs;
    }

    @Transactional
    public Company create(NewCompany company) {
        if (companies.existsByHandle(company.handle())) {
            throw new ValidationException("Duplicate company: " + company.handle());
        }
        Company created = companies.insert(company);
        log.info("Created company {}", created.handle());
        return created;
    }

    /** Companies matching every supplied filter, ordered by name. */
    public List<Company> findAll(CompanySearchCriteria criteria) {
        if (criteria != null
            && criteria.minEmployees() != null
            && criteria.maxEmployees() != null
            && criteria.minEmployees() > criteria.maxEmployees()) {
            throw new ValidationException("Min employees cannot be greater than max");
        }
        return companies.findAll(criteria);
    }

    public CompanyDetail get(String handle) {
        Company company = companies.findByHandle(handle);
        if (company == null) {
            throw new NotFoundException("No company: " + handle);
        }
        return CompanyDetail.of(company, jobs.findSummariesByCompany(handle));
    }

    public Company update(String handle, CompanyUpdate update) {
        Company company = companies.update(handle, update.toUpdateSpec());
        if (company == null) {
            throw new NotFoundException("No company: " + handle);
        }
        log.info("Updated company {}", handle);
        return company;
    }

    public void remove(String handle) {
        if (!companies.delete(handle)) {
            throw new NotFoundException("No company: " + handle);
        }
        log.info("Removed company {}", handle);
    }
}
