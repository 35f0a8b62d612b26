package com.jobly.board.api;

import com.jobly.board.auth.Capability;
import com.jobly.board.auth.RequiresCapability;
import com.jobly.board.model.Company;
import com.jobly.board.model.CompanyDetail;
import com.jobly.board.model.CompanySearchCriteria;
import com.jobly.board.model.CompanyUpdate;
import com.jobly.board.model.NewCompany;
import com.jobly.board.service.CompanyService;
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
@RequestMapping("/companies")
public class CompanyController {
    private final CompanyService companyService;
    private final RequestValidator validator;

    public CompanyController(CompanyService companyService, RequestValidator validator) {
        this.companyService = companyService;
        this.validator = validator;
    }

    @PostMapping
    @RequiresCapability(Capability.ADMIN)
    public ResponseEntity<Map<String, Company>> create(@RequestBody NewCompany company) {
        Company created = companyService.create(validator.validate(company));
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("company", created));
    }

    @GetMapping
    public Map<String, List<Company>> findAll(
        @RequestParam(name = "minEmployees", required = false) Integer minEmployees,
        @RequestParam(name = "maxEmployees", required = false) Integer maxEmployees,
        @RequestParam(name = "nameLike", required = false) String nameLike
    ) {
        CompanySearchCriteria criteria = validator.validate(
            new CompanySearchCriteria(minEmployees, maxEmployees, nameLike)
        );
        return Map.of("companies", companyService.findAll(criteria));
    }

    @GetMapping("/{handle}")
    public Map<String, CompanyDetail> get(@PathVariable("handle") String handle) {
        return Map.of("company", companyService.get(handle));
    }

    @PatchMapping("/{handle}")
    @RequiresCapability(Capability.ADMIN)
    public Map<String, Company> update(@PathVariable("handle") String handle, @RequestBody CompanyUpdate update) {
        return Map.of("company", companyService.update(handle, validator.validate(update)));
    }

    @DeleteMapping("/{handle}")
    @RequiresCapability(Capability.ADMIN)
    public Map<String, String> delete(@PathVariable("handle") String handle) {
        companyService.remove(handle);
        return Map.of("deleted", handle);
    }
}
