package com.work.escrow.app.web.dto;

import javax.validation.constraints.NotBlank;

import java.util.List;

/**
 * 提交 milestone 交付物。
 */
public class SubmitMilestoneRequest {

    /**
     * freelancer 钱包
     */
    @NotBlank(message = "wallet 不能为空")
    private String wallet;

    @NotBlank(message = "description 不能为空")
    private String description;

    private List<String> links;

    /**
     * 文件引用（存储由外部服务负责）
     */
    private List<String> fileReferences;

    public String getWallet() {
        return wallet;
    }

    public void setWallet(String wallet) {
        this.wallet = wallet;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getLinks() {
        return links;
    }

    public void setLinks(List<String> links) {
        this.links = links;
    }

    public List<String> getFileReferences() {
        return fileReferences;
    }

    public void setFileReferences(List<String> fileReferences) {
        this.fileReferences = fileReferences;
    }
}
