/*
 * どこで: marketplace-api (モノリス構成) のエントリポイント
 * 何を: 4 つの関数エンドポイントを 1 プロセスにまとめて起動する
 * なぜ: 単独デプロイと同じ EndpointGuard を共有し、構成によって認証漏れが生まれないようにするため
 */
package com.ontologymarket.marketplace_api;

import com.ontologymarket.add_ontologies.api.AddOntologiesController;
import com.ontologymarket.add_ontologies.service.AddOntologiesService;
import com.ontologymarket.auth.config.MarketplaceAuthConfig;
import com.ontologymarket.common.catalog.CatalogConfig;
import com.ontologymarket.common.config.MarketplaceCommonConfig;
import com.ontologymarket.delete_ontologies.api.DeleteOntologiesController;
import com.ontologymarket.delete_ontologies.service.DeleteOntologiesService;
import com.ontologymarket.search_ontologies.api.SearchOntologiesController;
import com.ontologymarket.search_ontologies.service.SearchOntologiesService;
import com.ontologymarket.tags.api.TagsController;
import com.ontologymarket.tags.service.TagsService;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({
  MarketplaceCommonConfig.class,
  MarketplaceAuthConfig.class,
  CatalogConfig.class,
  SearchOntologiesController.class,
  SearchOntologiesService.class,
  AddOntologiesController.class,
  AddOntologiesService.class,
  DeleteOntologiesController.class,
  DeleteOntologiesService.class,
  TagsController.class,
  TagsService.class
})
public class MarketplaceApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(MarketplaceApiApplication.class, args);
  }
}
